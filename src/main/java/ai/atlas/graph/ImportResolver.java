package ai.atlas.graph;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import ai.atlas.model.Ids;

/**
 * Maps raw import tokens to project files. Only the known path set is consulted,
 * never the filesystem. Strategies, first hit wins:
 * 1) exact path
 * 2) dotted module name ({@code app.services.main}, packages via {@code __init__})
 * 3) path relative to the importing file, with or without extension
 * 4) bare filename
 */
public final class ImportResolver {

    private static final String INIT_SUFFIX = ".__init__";

    private final Set<String> allFiles = new HashSet<>();
    private final Map<String, String> moduleMap = new HashMap<>();
    private final Map<String, String> stemMap = new HashMap<>();
    private final Map<String, String> basenameMap = new HashMap<>();

    public ImportResolver(Collection<String> knownPaths) {
        // sorted so "one arbitrary path" is the same one on every run
        for (String path : new TreeSet<>(knownPaths)) {
            allFiles.add(path);

            final String noExt = Ids.stripExtension(Ids.normalizePath(path));
            final String module = noExt.replace('/', '.');
            moduleMap.putIfAbsent(module, path);
            if (module.endsWith(INIT_SUFFIX)) {
                moduleMap.putIfAbsent(module.substring(0, module.length() - INIT_SUFFIX.length()), path);
            }
            if (!noExt.equals(path)) {
                stemMap.putIfAbsent(noExt, path);
            }
            basenameMap.putIfAbsent(Ids.basename(path), path);
        }
    }

    public Optional<String> resolve(String sourceFile, String rawImport) {
        final String target = sanitize(rawImport);
        if (target.isEmpty()) {
            return Optional.empty();
        }

        if (allFiles.contains(target)) {
            return Optional.of(target);
        }
        final String module = moduleMap.get(target);
        if (module != null) {
            return Optional.of(module);
        }

        final String relative = resolveRelative(sourceFile, target);
        if (relative != null) {
            return Optional.of(relative);
        }

        return Optional.ofNullable(basenameMap.get(Ids.basename(target)));
    }

    private String resolveRelative(String sourceFile, String target) {
        final String sourceDir = Ids.parentDir(sourceFile == null ? "" : sourceFile);
        final String candidate = ".".equals(target)
                ? sourceDir
                : normalize(sourceDir.isEmpty() ? target : sourceDir + "/" + target);
        if (candidate == null) {
            return null;
        }
        for (String c : List.of(candidate, candidate.replace('/', '\\'))) {
            if (allFiles.contains(c)) {
                return c;
            }
        }
        return stemMap.get(candidate);
    }

    /** Collapses "." and ".." segments; null when the path escapes the project root. */
    static String normalize(String path) {
        final Deque<String> parts = new ArrayDeque<>();
        for (String segment : path.replace('\\', '/').split("/")) {
            if (segment.isEmpty() || ".".equals(segment)) {
                continue;
            }
            if ("..".equals(segment)) {
                if (parts.isEmpty()) {
                    return null;
                }
                parts.removeLast();
                continue;
            }
            parts.addLast(segment);
        }
        return String.join("/", parts);
    }

    /** Strips surrounding quotes and angle brackets, repeatedly. */
    static String sanitize(String raw) {
        if (raw == null) {
            return "";
        }
        String clean = raw.trim();
        while (clean.length() >= 2 && isWrapped(clean)) {
            clean = clean.substring(1, clean.length() - 1).trim();
        }
        return clean;
    }

    private static boolean isWrapped(String s) {
        final char first = s.charAt(0);
        final char last = s.charAt(s.length() - 1);
        return (first == '"' && last == '"')
                || (first == '\'' && last == '\'')
                || (first == '<' && last == '>');
    }
}
