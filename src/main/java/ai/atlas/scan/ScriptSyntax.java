package ai.atlas.scan;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

import org.treesitter.TSLanguage;
import org.treesitter.TSNode;

import static ai.atlas.scan.SyntaxNodes.field;
import static ai.atlas.scan.SyntaxNodes.firstNamedChild;
import static ai.atlas.scan.SyntaxNodes.is;
import static ai.atlas.scan.SyntaxNodes.namedChildren;
import static ai.atlas.scan.SyntaxNodes.text;
import static ai.atlas.scan.SyntaxNodes.unquote;

/**
 * JavaScript and TypeScript. Static imports, re-exports, {@code require(..)}
 * and dynamic {@code import(..)} all yield their module specifier as written.
 */
final class ScriptSyntax implements LanguageSyntax {

    private static final Set<String> FUNCTIONS = Set.of(
            "function_declaration", "generator_function_declaration", "method_definition");
    private static final Set<String> CLASSES = Set.of(
            "class_declaration", "abstract_class_declaration", "interface_declaration");
    private static final Set<String> FUNCTION_VALUES = Set.of(
            "arrow_function", "function_expression", "function", "generator_function");
    private static final Set<String> STRINGS = Set.of("string", "template_string");

    private final Supplier<TSLanguage> grammar;

    ScriptSyntax(Supplier<TSLanguage> grammar) {
        this.grammar = grammar;
    }

    @Override
    public TSLanguage grammar() {
        return grammar.get();
    }

    @Override
    public boolean collectImports(TSNode node, SourceText source, List<String> out) {
        switch (node.getType()) {
            case "import_statement" -> {
                final TSNode from = field(node, "source");
                if (from != null) {
                    out.add(unquote(text(from, source)));
                }
                return true;
            }
            case "export_statement" -> {
                final TSNode from = field(node, "source");
                if (from == null) {
                    // "export function f() { require(..) }" still needs a visit
                    return false;
                }
                out.add(unquote(text(from, source)));
                return true;
            }
            case "call_expression" -> {
                final TSNode fn = field(node, "function");
                final boolean loads = is(fn, "import")
                        || (is(fn, "identifier") && "require".equals(text(fn, source)));
                if (loads) {
                    final TSNode arg = firstNamedChild(field(node, "arguments"), STRINGS);
                    if (arg != null) {
                        out.add(unquote(text(arg, source)));
                    }
                }
                return false;
            }
            default -> {
                return false;
            }
        }
    }

    @Override
    public Optional<Site> definition(TSNode node, SourceText source) {
        final String type = node.getType();
        if (FUNCTIONS.contains(type) || CLASSES.contains(type)) {
            final TSNode name = field(node, "name");
            if (name == null) {
                return Optional.empty();
            }
            final String kind = CLASSES.contains(type) ? Definition.CLASS : Definition.FUNCTION;
            return Optional.of(new Site(text(name, source), kind, node, field(node, "body")));
        }
        if ("variable_declarator".equals(type)) {
            final TSNode name = field(node, "name");
            final TSNode value = field(node, "value");
            if (!is(name, "identifier") || value == null || !FUNCTION_VALUES.contains(value.getType())) {
                return Optional.empty();
            }
            // "const f = () => {}" spans the whole declaration when it declares nothing else
            final TSNode parent = node.getParent();
            final TSNode span = SyntaxNodes.present(parent) && namedChildren(parent).size() == 1 ? parent : node;
            return Optional.of(new Site(text(name, source), Definition.FUNCTION, span, field(value, "body")));
        }
        return Optional.empty();
    }

    @Override
    public TSNode calleeName(TSNode node) {
        if (!"call_expression".equals(node.getType())) {
            return null;
        }
        final TSNode fn = field(node, "function");
        if (fn == null) {
            return null;
        }
        return switch (fn.getType()) {
            case "identifier" -> fn;
            case "member_expression" -> field(fn, "property");
            default -> null;
        };
    }
}
