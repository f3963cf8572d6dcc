package ai.atlas.scan;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TreeSitterKotlin;

import static ai.atlas.scan.SyntaxNodes.firstNamedChild;
import static ai.atlas.scan.SyntaxNodes.lastNamedChild;
import static ai.atlas.scan.SyntaxNodes.text;

/**
 * Kotlin. The grammar names few fields, so names and bodies are found by
 * node type. {@code import a.b.C} gives {@code a/b/C.kt}; a wildcard import
 * gives the package directory.
 */
final class KotlinSyntax implements LanguageSyntax {

    private static final Set<String> CLASS_BODIES = Set.of("class_body", "enum_class_body");

    @Override
    public TSLanguage grammar() {
        return new TreeSitterKotlin();
    }

    @Override
    public boolean collectImports(TSNode node, SourceText source, List<String> out) {
        if (!"import_header".equals(node.getType())) {
            return false;
        }
        final TSNode identifier = firstNamedChild(node, "identifier");
        if (identifier == null) {
            return true;
        }
        final String path = text(identifier, source).replaceAll("\\s+", "").replace('.', '/');
        final boolean wildcard = firstNamedChild(node, "wildcard_import") != null
                || text(node, source).trim().endsWith("*");
        out.add(wildcard ? path : path + ".kt");
        return true;
    }

    @Override
    public Optional<Site> definition(TSNode node, SourceText source) {
        switch (node.getType()) {
            case "class_declaration", "object_declaration" -> {
                final TSNode name = firstNamedChild(node, "type_identifier");
                return name == null
                        ? Optional.empty()
                        : Optional.of(new Site(text(name, source), Definition.CLASS, node,
                                firstNamedChild(node, CLASS_BODIES)));
            }
            case "function_declaration" -> {
                final TSNode name = firstNamedChild(node, "simple_identifier");
                return name == null
                        ? Optional.empty()
                        : Optional.of(new Site(text(name, source), Definition.FUNCTION, node,
                                firstNamedChild(node, "function_body")));
            }
            default -> {
                return Optional.empty();
            }
        }
    }

    @Override
    public TSNode calleeName(TSNode node) {
        if (!"call_expression".equals(node.getType()) || node.getNamedChildCount() == 0) {
            return null;
        }
        final TSNode callee = node.getNamedChild(0);
        if (SyntaxNodes.is(callee, "simple_identifier")) {
            return callee;
        }
        if (SyntaxNodes.is(callee, "navigation_expression")) {
            final TSNode suffix = lastNamedChild(callee);
            return SyntaxNodes.is(suffix, "navigation_suffix") ? firstNamedChild(suffix, "simple_identifier") : null;
        }
        return null;
    }
}
