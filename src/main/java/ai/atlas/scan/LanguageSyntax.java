package ai.atlas.scan;

import java.util.List;
import java.util.Optional;

import org.treesitter.TSLanguage;
import org.treesitter.TSNode;

/**
 * Grammar-specific knowledge the tree-sitter parser needs for one language
 * family: which nodes are imports, which declare functions or types and which
 * are calls.
 */
interface LanguageSyntax {

    /** A declaration found in the tree. {@code body} is null for header-only forms. */
    record Site(String name, String kind, TSNode span, TSNode body) {
    }

    /** A fresh grammar instance; loads the native library on first use. */
    TSLanguage grammar();

    /**
     * Appends the import tokens carried by {@code node}.
     *
     * @return true when the node is an import construct and its subtree needs no further visit
     */
    boolean collectImports(TSNode node, SourceText source, List<String> out);

    Optional<Site> definition(TSNode node, SourceText source);

    /** Node holding the called name when {@code node} is a call, else null. */
    TSNode calleeName(TSNode node);
}
