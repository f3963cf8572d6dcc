package ai.atlas.scan;

import java.util.List;
import java.util.Optional;

import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TreeSitterGo;

import static ai.atlas.scan.SyntaxNodes.field;
import static ai.atlas.scan.SyntaxNodes.namedChildren;
import static ai.atlas.scan.SyntaxNodes.text;
import static ai.atlas.scan.SyntaxNodes.unquote;

/**
 * Go. Import paths are kept as written; struct and interface types count as
 * classes, methods are named without their receiver.
 */
final class GoSyntax implements LanguageSyntax {

    @Override
    public TSLanguage grammar() {
        return new TreeSitterGo();
    }

    @Override
    public boolean collectImports(TSNode node, SourceText source, List<String> out) {
        if (!"import_spec".equals(node.getType())) {
            return false;
        }
        final TSNode path = field(node, "path");
        if (path != null) {
            out.add(unquote(text(path, source)));
        }
        return true;
    }

    @Override
    public Optional<Site> definition(TSNode node, SourceText source) {
        switch (node.getType()) {
            case "function_declaration", "method_declaration" -> {
                final TSNode name = field(node, "name");
                return name == null
                        ? Optional.empty()
                        : Optional.of(new Site(text(name, source), Definition.FUNCTION, node, field(node, "body")));
            }
            case "type_spec" -> {
                final TSNode name = field(node, "name");
                final TSNode type = field(node, "type");
                if (name == null || type == null) {
                    return Optional.empty();
                }
                final String shape = type.getType();
                if (!"struct_type".equals(shape) && !"interface_type".equals(shape)) {
                    return Optional.empty();
                }
                // "type X struct {..}" spans the keyword unless it sits in a "type (..)" group
                final TSNode parent = node.getParent();
                final TSNode span = SyntaxNodes.is(parent, "type_declaration") && namedChildren(parent).size() == 1
                        ? parent : node;
                final TSNode body = "struct_type".equals(shape)
                        ? SyntaxNodes.firstNamedChild(type, "field_declaration_list") : type;
                return Optional.of(new Site(text(name, source), Definition.CLASS, span, body));
            }
            default -> {
                return Optional.empty();
            }
        }
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
            case "selector_expression" -> field(fn, "field");
            default -> null;
        };
    }
}
