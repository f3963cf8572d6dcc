package ai.atlas.scan;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

import org.treesitter.TSLanguage;
import org.treesitter.TSNode;

import static ai.atlas.scan.SyntaxNodes.field;
import static ai.atlas.scan.SyntaxNodes.is;
import static ai.atlas.scan.SyntaxNodes.lastNamedChild;
import static ai.atlas.scan.SyntaxNodes.text;

/**
 * C and C++. Includes keep their delimiters ({@code <stdio.h>},
 * {@code "util.h"}); prototypes are declarations, not definitions.
 */
final class CFamilySyntax implements LanguageSyntax {

    private static final Set<String> TYPE_SPECIFIERS = Set.of(
            "struct_specifier", "union_specifier", "enum_specifier", "class_specifier");
    private static final Set<String> NAME_NODES = Set.of(
            "identifier", "field_identifier", "destructor_name", "operator_name", "type_identifier");

    private final Supplier<TSLanguage> grammar;

    CFamilySyntax(Supplier<TSLanguage> grammar) {
        this.grammar = grammar;
    }

    @Override
    public TSLanguage grammar() {
        return grammar.get();
    }

    @Override
    public boolean collectImports(TSNode node, SourceText source, List<String> out) {
        if (!"preproc_include".equals(node.getType())) {
            return false;
        }
        final TSNode path = field(node, "path");
        if (path != null) {
            out.add(text(path, source).trim());
        }
        return true;
    }

    @Override
    public Optional<Site> definition(TSNode node, SourceText source) {
        final String type = node.getType();
        if ("function_definition".equals(type)) {
            final TSNode name = declaratorName(field(node, "declarator"));
            if (name == null) {
                return Optional.empty();
            }
            return Optional.of(new Site(text(name, source), Definition.FUNCTION, node, field(node, "body")));
        }
        if (TYPE_SPECIFIERS.contains(type)) {
            final TSNode name = field(node, "name");
            final TSNode body = field(node, "body");
            // "struct point p;" only references the type
            if (name == null || body == null) {
                return Optional.empty();
            }
            return Optional.of(new Site(text(name, source), Definition.CLASS, node, body));
        }
        return Optional.empty();
    }

    /** Innermost name of a (possibly pointer, reference or qualified) declarator. */
    static TSNode declaratorName(TSNode declarator) {
        TSNode current = declarator;
        while (current != null) {
            if (NAME_NODES.contains(current.getType())) {
                return current;
            }
            if (is(current, "qualified_identifier")) {
                current = field(current, "name");
                continue;
            }
            final TSNode inner = field(current, "declarator");
            current = inner != null ? inner : lastNamedChild(current);
        }
        return null;
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
                case "field_expression" -> fn = field(fn, "field");
                case "qualified_identifier", "template_function" -> fn = field(fn, "name");
                default -> {
                    return null;
                }
            }
        }
        return null;
    }
}
