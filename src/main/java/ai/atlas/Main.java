package ai.atlas;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ai.atlas.graph.BuildResult;
import ai.atlas.io.AtlasConfig;
import ai.atlas.io.GraphStore;
import ai.atlas.model.GraphKind;
import ai.atlas.model.ParsedFile;
import ai.atlas.render.JsonLinesGraphView;
import ai.atlas.render.ProgressiveLoader;
import ai.atlas.render.RenderPlan;
import ai.atlas.scan.ProgressListener;
import ai.atlas.session.ProjectSession;

public final class Main {

    public static void main(String[] args) {
        final int code = run(args, System.out, System.err);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Path root = null;
        Path dataDir = null;
        boolean full = true;
        String command = null;
        final List<String> operands = new ArrayList<>();
        final Map<String, String> overrides = new LinkedHashMap<>();

        try {
            for (String arg : args) {
                if ("--help".equals(arg) || "-h".equals(arg)) {
                    printUsage(out);
                    return 0;
                }
                if (arg.startsWith("--root=")) {
                    root = Paths.get(arg.substring("--root=".length()));
                    continue;
                }
                if (arg.startsWith("--dataDir=")) {
                    dataDir = Paths.get(arg.substring("--dataDir=".length()));
                    continue;
                }
                if (arg.startsWith("--full=")) {
                    full = Boolean.parseBoolean(arg.substring("--full=".length()));
                    continue;
                }
                if (arg.startsWith("--") && arg.indexOf('=') > 2) {
                    final String key = arg.substring(2, arg.indexOf('='));
                    if (AtlasConfig.KEYS.contains(key)) {
                        overrides.put(key, arg.substring(arg.indexOf('=') + 1));
                        continue;
                    }
                }
                if (arg.startsWith("--")) {
                    err.println("ERROR: unknown argument: " + arg);
                    printUsage(err);
                    return 2;
                }
                if (command == null) {
                    command = arg;
                } else {
                    operands.add(arg);
                }
            }

            if (command == null) {
                err.println("ERROR: missing command");
                printUsage(err);
                return 2;
            }
            if (root == null) {
                root = Paths.get(".");
            }
            root = root.toAbsolutePath().normalize();
            if (dataDir != null && !dataDir.isAbsolute()) {
                dataDir = root.resolve(dataDir).normalize();
            }

            final AtlasConfig config = AtlasConfig.load(root, overrides);
            final ProjectSession session = ProjectSession.open(root, dataDir, config);
            return dispatch(session, command, operands, full, out, err);
        } catch (IOException ex) {
            err.println("ERROR: IO failure: " + safeMsg(ex.getMessage()));
            return 2;
        } catch (IllegalArgumentException ex) {
            err.println("ERROR: " + safeMsg(ex.getMessage()));
            return 2;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            err.println("ERROR: interrupted");
            return 1;
        } catch (Exception ex) {
            err.println("ERROR: failed to run " + command + ": "
                    + ex.getClass().getSimpleName() + ": " + safeMsg(ex.getMessage()));
            return 1;
        }
    }

    private static int dispatch(ProjectSession session, String command, List<String> operands, boolean full,
                                PrintStream out, PrintStream err) throws IOException, InterruptedException {
        final ProgressListener progress = (current, total, message) ->
                err.println("[" + current + "/" + total + "] " + message);

        switch (command) {
            case "structure" -> summary(out, "Structure", session.buildStructure(progress));
            case "dependencies" -> summary(out, "Dependency", session.buildDependencies(progress));
            case "scope" -> summary(out, "Scope", session.buildScope(progress));
            case "all" -> {
                summary(out, "Structure", session.buildStructure(progress));
                summary(out, "Dependency", session.buildDependencies(progress));
                summary(out, "Scope", session.buildScope(progress));
            }
            case "show" -> {
                if (operands.size() != 1) {
                    err.println("ERROR: show needs exactly one graph kind (structure|dependency|scope)");
                    return 2;
                }
                final RenderPlan plan = session.loadGraph(GraphKind.fromCliName(operands.get(0)), full);
                final ProgressiveLoader loader = new ProgressiveLoader(new JsonLinesGraphView(out), Runnable::run,
                        session.config().initialLoadSize(), session.config().chunkSize());
                loader.present(plan);
                // no interactive front-end: acknowledge the page immediately
                loader.pageLoaded();
            }
            case "scope-add" -> {
                if (operands.isEmpty()) {
                    err.println("ERROR: scope-add needs at least one file");
                    return 2;
                }
                final List<String> added = session.scope().add(operands);
                out.println("Added " + added.size() + " file(s) to scope");
                added.forEach(f -> out.println("  + " + f));
            }
            case "scope-remove" -> {
                final List<String> removed = session.scope().remove(operands);
                out.println("Removed " + removed.size() + " file(s) from scope");
                removed.forEach(f -> out.println("  - " + f));
            }
            case "scope-clear" -> {
                session.scope().clear();
                out.println("Scope cleared");
            }
            case "scope-list" -> session.scope().list().forEach(out::println);
            case "extrapolate" -> {
                if (operands.size() != 1) {
                    err.println("ERROR: extrapolate needs exactly one file");
                    return 2;
                }
                session.extrapolateDependencies(operands.get(0)).forEach(out::println);
            }
            case "search" -> session.searchFiles(String.join(" ", operands)).forEach(out::println);
            case "clear-cache" -> {
                session.clearCache();
                out.println("Cache cleared: " + session.dataDir());
            }
            default -> {
                err.println("ERROR: unknown command: " + command);
                printUsage(err);
                return 2;
            }
        }
        return 0;
    }

    private static void summary(PrintStream out, String label, BuildResult result) {
        out.println(label + " graph written: " + result.full().name()
                + " (" + result.full().graph().nodeCount() + " nodes, "
                + result.full().graph().edgeCount() + " edges), "
                + result.simple().name()
                + " (" + result.simple().graph().nodeCount() + " nodes)");
        if (result.full().staticImagePath() != null) {
            out.println("Static image: " + result.full().staticImagePath());
        }
        final long failed = result.full().metadata().values().stream().filter(ParsedFile::failed).count();
        if (failed > 0) {
            out.println("WARN: parse failures: " + failed);
        }
        out.println("Schema: " + GraphStore.SCHEMA_VERSION);
    }

    private static void printUsage(PrintStream out) {
        out.println("Usage: code-atlas <command> [args] [options]");
        out.println("Commands:");
        out.println("  structure                 Build the directory/file graph");
        out.println("  dependencies              Build the import graph (builds structure if missing)");
        out.println("  scope                     Build the symbol graph over the scope set");
        out.println("  all                       structure, dependencies and scope in turn");
        out.println("  show <kind>               Stream a graph (structure|dependency|scope) as JSON lines");
        out.println("  scope-add <files..>       Add project-relative files to the scope set");
        out.println("  scope-remove <files..>    Remove files from the scope set");
        out.println("  scope-clear               Empty the scope set");
        out.println("  scope-list                Print the scope set");
        out.println("  extrapolate <file>        Print a file with its importers and imports");
        out.println("  search <query>            Find source files by path substring");
        out.println("  clear-cache               Delete all graphs, images and the scope set");
        out.println("Options:");
        out.println("  --root=<path>             Project root (default: current directory)");
        out.println("  --dataDir=<path>          Data directory (default: <root>/" + AtlasConfig.DATA_DIR_NAME + ")");
        out.println("  --full=<bool>             show: full tier (default) or simple tier");
        out.println("  --<setting>=<value>       Override a setting: " + String.join(", ", AtlasConfig.KEYS));
        out.println("  --help, -h                Show this help");
    }

    private static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}
