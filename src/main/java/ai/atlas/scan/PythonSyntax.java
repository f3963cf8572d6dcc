package ai.atlas.scan;

import java.util.List;
import java.util.Optional;

import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TreeSitterPython;

import static ai.atlas.scan.SyntaxNodes.field;
import static ai.atlas.scan.SyntaxNodes.firstNamedChild;
import static ai.atlas.scan.SyntaxNodes.namedChildren;
import static ai.atlas.scan.SyntaxNodes.text;

/**
 * Python. Absolute imports stay dotted ({@code app.models}); relative ones
 * become path tokens: {@code from .x import y} gives {@code ./x},
 * {@code from .. import z} gives {@code ../z}.
 */
final class PythonSyntax implements LanguageSyntax {

    @Override
    public TSLanguage grammar() {
        return new TreeSitterPython();
    }

    @Override
    public boolean collectImports(TSNode node, SourceText source, List<String> out) {
        switch (node.getType()) {
            case "import_statement" -> {
                for (TSNode child : namedChildren(node)) {
                    final String name = importedName(child, source);
                    if (name != null) {
                        out.add(name);
                    }
                }
                return true;
            }
            case "import_from_statement" -> {
                fromImport(node, source, out);
                return true;
            }
            case "future_import_statement" -> {
                return true;
            }
            default -> {
                return false;
            }
        }
    }

    private static void fromImport(TSNode node, SourceText source, List<String> out) {
        final TSNode module = field(node, "module_name");
        if (module == null) {
            return;
        }
        if (!"relative_import".equals(module.getType())) {
            out.add(text(module, source));
            return;
        }

        final TSNode dotsNode = firstNamedChild(module, "import_prefix");
        final int dots = dotsNode == null ? 1 : text(dotsNode, source).trim().length();
        final String prefix = dots <= 1 ? "./" : "../".repeat(dots - 1);
        final TSNode dotted = firstNamedChild(module, "dotted_name");
        if (dotted != null) {
            out.add(prefix + text(dotted, source).replace('.', '/'));
            return;
        }
        // "from . import a, b": each name is a sibling module; the relative_import itself yields null
        for (TSNode child : namedChildren(node)) {
            final String name = importedName(child, source);
            if (name != null) {
                out.add(prefix + name.replace('.', '/'));
            }
        }
    }

    private static String importedName(TSNode child, SourceText source) {
        switch (child.getType()) {
            case "dotted_name" -> {
                return text(child, source);
            }
            case "aliased_import" -> {
                final TSNode name = field(child, "name");
                return name == null ? null : text(name, source);
            }
            default -> {
                return null;
            }
        }
    }

    @Override
    public Optional<Site> definition(TSNode node, SourceText source) {
        final String kind;
        switch (node.getType()) {
            case "function_definition" -> kind = Definition.FUNCTION;
            case "class_definition" -> kind = Definition.CLASS;
            default -> {
                return Optional.empty();
            }
        }
        final TSNode name = field(node, "name");
        if (name == null) {
            return Optional.empty();
        }
        return Optional.of(new Site(text(name, source), kind, node, field(node, "body")));
    }

    @Override
    public TSNode calleeName(TSNode node) {
        if (!"call".equals(node.getType())) {
            return null;
        }
        final TSNode fn = field(node, "function");
        if (fn == null) {
            return null;
        }
        return switch (fn.getType()) {
            case "identifier" -> fn;
            case "attribute" -> field(fn, "attribute");
            default -> null;
        };
    }
}
