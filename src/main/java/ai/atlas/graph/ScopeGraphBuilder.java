package ai.atlas.graph;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.atlas.io.GraphStore;
import ai.atlas.model.EdgeKind;
import ai.atlas.model.GraphKind;
import ai.atlas.model.Ids;
import ai.atlas.model.NodeKind;
import ai.atlas.model.Tier;
import ai.atlas.render.StaticRasterGenerator;
import ai.atlas.scan.Definition;
import ai.atlas.scan.ParseResult;
import ai.atlas.scan.ProgressListener;
import ai.atlas.scan.SourceParser;

/**
 * Symbol-level graph over the scope set.
 *
 * Nodes: one per scope file plus one per definition ({@code path::name}).
 * Edges:
 * - {@code dependency}: scope file A to scope file B when the dependency graph
 *   has a directed path A to B
 * - {@code defines}: file to each of its definitions
 * - {@code calls}: definition to the definition a called name is matched to
 *   (same file first, else the first definition seen with that name)
 */
public final class ScopeGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(ScopeGraphBuilder.class);

    private static final int STAGES = 5;

    static final int TOOLTIP_ROWS = 20;
    static final int SIGNATURE_LIMIT = 60;
    static final double DEFINITION_SIZE = 10.0;

    static final String ATTR_DEF_TYPE = "defType";
    static final String ATTR_CALLS = "calls";
    static final String ATTR_CONTENT = "content";

    private final GraphStore store;
    private final SourceParser parser;
    private final StaticRasterGenerator raster;

    public ScopeGraphBuilder(GraphStore store, SourceParser parser, StaticRasterGenerator raster) {
        this.store = Objects.requireNonNull(store, "store");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.raster = Objects.requireNonNull(raster, "raster");
    }

    public BuildResult build(Path projectRoot, Collection<String> scopeFiles, ProgressListener listener) throws IOException {
        Objects.requireNonNull(projectRoot, "projectRoot");
        final ProgressListener progress = listener == null ? ProgressListener.NONE : listener;
        final String fullName = GraphKind.SCOPE.artifactName(Tier.FULL);
        final String simpleName = GraphKind.SCOPE.artifactName(Tier.SIMPLE);

        final CodeGraph dependencies = store.load(GraphKind.DEPENDENCY.artifactName(Tier.FULL)).graph();

        final List<String> scope = new ArrayList<>(new TreeSet<>(scopeFiles));
        if (scope.isEmpty()) {
            log.info("Scope is empty, writing empty scope graphs");
            final BuildResult empty = new BuildResult(GraphSnapshot.empty(fullName), GraphSnapshot.empty(simpleName));
            store.save(empty.full());
            store.save(empty.simple());
            return empty;
        }

        progress.onProgress(1, STAGES, "Building scope topology...");
        final CodeGraph graph = CodeGraph.empty();
        for (String file : scope) {
            graph.addNode(fileNode(file, dependencies.node(file)));
        }
        for (String source : scope) {
            for (String target : scope) {
                if (!source.equals(target) && dependencies.hasPath(source, target)) {
                    graph.addEdge(new GraphEdge(source, target, EdgeKind.DEPENDENCY, EdgeStyle.DEPENDENCY));
                }
            }
        }

        progress.onProgress(2, STAGES, "Parsing internal structure...");
        for (String file : scope) {
            final Path absolute = projectRoot.resolve(file);
            if (!Files.isRegularFile(absolute)) {
                log.debug("Scope entry {} not on disk, skipping its definitions", file);
                continue;
            }
            final ParseResult parsed = parser.parse(absolute, true);
            if (parsed.failed()) {
                log.warn("Detailed parse of {} failed: {}", file, parsed.error());
            }
            addDefinitions(graph, file, parsed.definitions());
        }

        progress.onProgress(3, STAGES, "Linking function calls...");
        final int calls = linkCalls(graph);
        log.info("Scope graph: {} nodes, {} edges ({} calls)", graph.nodeCount(), graph.edgeCount(), calls);

        progress.onProgress(4, STAGES, "Rendering scope visualization...");
        final String staticImage = raster.generate(graph, Map.of(), fullName, store.rasterPath(fullName))
                .map(Path::toString)
                .orElse(null);
        final GraphSnapshot full = new GraphSnapshot(fullName, graph, Map.of(), Map.of(), staticImage);
        store.save(full);

        // file nodes keep their tooltips; only dependency edges run between files
        final GraphSnapshot simple = GraphSnapshot.of(simpleName, graph.induced(scope));
        store.save(simple);

        progress.onProgress(STAGES, STAGES, "Scope processing complete.");
        return new BuildResult(full, simple);
    }

    private static GraphNode fileNode(String file, GraphNode inherited) {
        final GraphNode node = new GraphNode(file, NodeKind.FILE, Ids.basename(file));
        if (inherited != null) {
            node.label(inherited.label()).group(inherited.group()).size(inherited.size());
        }
        if (node.group() == null) {
            node.group(GraphStyler.groupOf(file));
        }
        return node;
    }

    private static void addDefinitions(CodeGraph graph, String file, List<Definition> definitions) {
        final GraphNode fileNode = graph.node(file);
        final List<String> rows = new ArrayList<>();

        for (Definition d : definitions) {
            final String signature = displaySignature(d);
            final String id = Ids.definitionId(file, d.name());
            final GraphNode existing = graph.node(id);
            if (existing != null) {
                // overloads share one node; their calls are merged
                final Set<String> merged = new LinkedHashSet<>(callsOf(existing));
                merged.addAll(d.calls());
                existing.attr(ATTR_CALLS, new ArrayList<>(merged));
            } else {
                graph.addNode(new GraphNode(id, NodeKind.DEFINITION, d.name())
                        .group(fileNode.group())
                        .size(DEFINITION_SIZE)
                        .title("<b>" + escapeHtml(d.name()) + "</b><br><pre>" + escapeHtml(signature) + "</pre>")
                        .attr(ATTR_DEF_TYPE, d.kind())
                        .attr(ATTR_CALLS, new ArrayList<>(d.calls()))
                        .attr(ATTR_CONTENT, d.content()));
                graph.addEdge(new GraphEdge(file, id, EdgeKind.DEFINES, EdgeStyle.DEFINES));
            }
            rows.add(tooltipRow(d.kind(), signature));
        }
        fileNode.title(fileTooltip(file, rows));
    }

    /**
     * Adds one {@code calls} edge per (definition, called name) pair that matches a
     * definition in scope.
     *
     * @return number of call edges added
     */
    static int linkCalls(CodeGraph graph) {
        final Map<String, List<String>> byName = new LinkedHashMap<>();
        final List<GraphNode> definitions = new ArrayList<>();
        for (GraphNode n : graph.nodes()) {
            if (n.kind() == NodeKind.DEFINITION) {
                byName.computeIfAbsent(Ids.shortName(n.id()), k -> new ArrayList<>()).add(n.id());
                definitions.add(n);
            }
        }

        int count = 0;
        for (GraphNode caller : definitions) {
            final String origin = Ids.ownerPath(caller.id());
            for (String called : callsOf(caller)) {
                final List<String> candidates = byName.get(called);
                if (candidates == null || candidates.isEmpty()) {
                    continue;
                }
                String target = candidates.get(0);
                for (String c : candidates) {
                    if (Ids.ownerPath(c).equals(origin)) {
                        target = c;
                        break;
                    }
                }
                if (!target.equals(caller.id()) && !graph.hasEdge(caller.id(), target)) {
                    graph.addEdge(new GraphEdge(caller.id(), target, EdgeKind.CALLS, EdgeStyle.CALLS));
                    count++;
                }
            }
        }
        return count;
    }

    private static List<String> callsOf(GraphNode node) {
        final Object raw = node.attr(ATTR_CALLS);
        if (!(raw instanceof List<?> list)) {
            return List.of();
        }
        final List<String> calls = new ArrayList<>(list.size());
        for (Object o : list) {
            calls.add(String.valueOf(o));
        }
        return calls;
    }

    /** First line of the declaration, opening brace dropped, capped in length. */
    static String displaySignature(Definition d) {
        final String source = d.signature() != null && !d.signature().isBlank() ? d.signature() : d.content();
        String line = source == null ? "" : source.strip().split("\\R", 2)[0].strip();
        if (line.endsWith("{")) {
            line = line.substring(0, line.length() - 1).strip();
        }
        if (line.length() > SIGNATURE_LIMIT) {
            line = line.substring(0, SIGNATURE_LIMIT - 3) + "...";
        }
        return line;
    }

    private static String tooltipRow(String kind, String signature) {
        final String style = Definition.FUNCTION.equals(kind)
                ? "color:#e06c75; font-weight:bold;"
                : "color:#e5c07b; font-weight:bold;";
        final String letter = kind == null || kind.isEmpty() ? "?" : kind.substring(0, 1).toUpperCase(Locale.ROOT);
        return "<tr><td style='" + style + " padding-right:8px;'>" + letter + "</td>"
                + "<td style='font-family:monospace; color:#ccc;'>" + escapeHtml(signature) + "</td></tr>";
    }

    static String fileTooltip(String file, List<String> rows) {
        final String name = escapeHtml(Ids.basename(file));
        if (rows.isEmpty()) {
            return "<b>" + name + "</b><br><i style='font-size:10px; color:#888'>No structures found</i>";
        }
        final StringBuilder table = new StringBuilder("<table style='border-spacing:0; font-size:11px;'>");
        for (String row : rows.subList(0, Math.min(TOOLTIP_ROWS, rows.size()))) {
            table.append(row);
        }
        if (rows.size() > TOOLTIP_ROWS) {
            table.append("<tr><td colspan='2'><i>...and more...</i></td></tr>");
        }
        table.append("</table>");
        return "<div style='text-align:left;'>"
                + "<div style='font-weight:bold; border-bottom:1px solid #555; margin-bottom:4px; font-size:12px;'>"
                + name + "</div>" + table + "</div>";
    }

    static String escapeHtml(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;")
                .replace("'", "&#39;");
    }
}
