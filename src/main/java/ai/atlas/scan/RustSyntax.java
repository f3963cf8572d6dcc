package ai.atlas.scan;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TreeSitterRust;

import static ai.atlas.scan.SyntaxNodes.field;
import static ai.atlas.scan.SyntaxNodes.namedChildren;
import static ai.atlas.scan.SyntaxNodes.text;

/**
 * Rust. {@code use} paths become path tokens ({@code crate::a::b} gives
 * {@code ./a/b} and {@code ./a}); a body-less {@code mod x;} gives {@code ./x}.
 */
final class RustSyntax implements LanguageSyntax {

    private static final Set<String> TYPES = Set.of("struct_item", "enum_item", "union_item", "trait_item");

    @Override
    public TSLanguage grammar() {
        return new TreeSitterRust();
    }

    @Override
    public boolean collectImports(TSNode node, SourceText source, List<String> out) {
        switch (node.getType()) {
            case "use_declaration" -> {
                final TSNode argument = field(node, "argument");
                if (argument != null) {
                    final List<String> paths = new ArrayList<>();
                    usePaths(argument, "", source, paths);
                    paths.forEach(p -> pathTokens(p, out));
                }
                return true;
            }
            case "mod_item" -> {
                final TSNode name = field(node, "name");
                if (field(node, "body") == null && name != null) {
                    out.add("./" + text(name, source));
                    return true;
                }
                return false;
            }
            default -> {
                return false;
            }
        }
    }

    /** Expands brace groups: {@code a::{b, c::d}} gives {@code a::b} and {@code a::c::d}. */
    private static void usePaths(TSNode node, String prefix, SourceText source, List<String> out) {
        switch (node.getType()) {
            case "use_as_clause" -> {
                final TSNode path = field(node, "path");
                if (path != null) {
                    usePaths(path, prefix, source, out);
                }
            }
            case "use_wildcard" -> {
                String path = text(node, source).trim();
                path = path.endsWith("*") ? path.substring(0, path.length() - 1) : path;
                out.add(prefix + stripSeparator(path));
            }
            case "scoped_use_list" -> {
                final TSNode path = field(node, "path");
                final TSNode list = field(node, "list");
                final String next = path == null ? prefix : prefix + text(path, source) + "::";
                if (list != null) {
                    usePaths(list, next, source, out);
                }
            }
            case "use_list" -> {
                for (TSNode item : namedChildren(node)) {
                    usePaths(item, prefix, source, out);
                }
            }
            default -> out.add(prefix + text(node, source).trim());
        }
    }

    private static String stripSeparator(String path) {
        return path.endsWith("::") ? path.substring(0, path.length() - 2) : path;
    }

    private static void pathTokens(String path, List<String> out) {
        final String[] segments = path.split("::");
        String prefix = "";
        int i = 0;
        if (segments.length > 0) {
            switch (segments[0]) {
                case "crate", "self" -> {
                    prefix = "./";
                    i = 1;
                }
                case "super" -> {
                    prefix = "../";
                    i = 1;
                }
                default -> {
                }
            }
        }
        final List<String> rest = new ArrayList<>();
        for (; i < segments.length; i++) {
            if (!segments[i].isBlank()) {
                rest.add(segments[i].trim());
            }
        }
        if (rest.isEmpty()) {
            return;
        }
        out.add(prefix + String.join("/", rest));
        if (rest.size() > 1) {
            // the last segment is often an item inside the module file
            out.add(prefix + String.join("/", rest.subList(0, rest.size() - 1)));
        }
    }

    @Override
    public Optional<Site> definition(TSNode node, SourceText source) {
        final String type = node.getType();
        final String kind;
        if ("function_item".equals(type)) {
            kind = Definition.FUNCTION;
        } else if (TYPES.contains(type)) {
            kind = Definition.CLASS;
        } else {
            return Optional.empty();
        }
        final TSNode name = field(node, "name");
        if (name == null) {
            return Optional.empty();
        }
        return Optional.of(new Site(text(name, source), kind, node, field(node, "body")));
    }

    @Override
    public TSNode calleeName(TSNode node) {
        if (!"call_expression".equals(node.getType())) {
            return null;
        }
        TSNode fn = field(node, "function");
        while (fn != null) {
            switch (fn.getType()) {
                case "identifier", "field_identifier" -> {
                    return fn;
                }
                case "scoped_identifier" -> fn = field(fn, "name");
                case "field_expression" -> fn = field(fn, "field");
                case "generic_function" -> fn = field(fn, "function");
                default -> {
                    return null;
                }
            }
        }
        return null;
    }
}
