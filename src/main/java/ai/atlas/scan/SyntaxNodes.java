package ai.atlas.scan;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

import org.treesitter.TSNode;

/**
 * Null-safe helpers over tree-sitter nodes. Absent children come back as
 * {@code null}, never as a null node.
 */
final class SyntaxNodes {

    private SyntaxNodes() {
    }

    static boolean present(TSNode node) {
        return node != null && !node.isNull();
    }

    static TSNode field(TSNode node, String name) {
        if (!present(node)) {
            return null;
        }
        final TSNode child = node.getChildByFieldName(name);
        return present(child) ? child : null;
    }

    static List<TSNode> namedChildren(TSNode node) {
        final int n = node.getNamedChildCount();
        final List<TSNode> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            final TSNode child = node.getNamedChild(i);
            if (present(child)) {
                out.add(child);
            }
        }
        return out;
    }

    static TSNode firstNamedChild(TSNode node, Set<String> types) {
        if (!present(node)) {
            return null;
        }
        for (TSNode child : namedChildren(node)) {
            if (types.contains(child.getType())) {
                return child;
            }
        }
        return null;
    }

    static TSNode firstNamedChild(TSNode node, String type) {
        return firstNamedChild(node, Set.of(type));
    }

    static TSNode lastNamedChild(TSNode node) {
        final int n = node.getNamedChildCount();
        if (n == 0) {
            return null;
        }
        final TSNode last = node.getNamedChild(n - 1);
        return present(last) ? last : null;
    }

    static boolean is(TSNode node, String type) {
        return present(node) && type.equals(node.getType());
    }

    static String text(TSNode node, SourceText source) {
        return source.slice(node.getStartByte(), node.getEndByte());
    }

    /** String literal contents without the surrounding quote characters. */
    static String unquote(String literal) {
        String s = literal.trim();
        while (s.length() >= 2 && isQuote(s.charAt(0)) && s.charAt(s.length() - 1) == s.charAt(0)) {
            s = s.substring(1, s.length() - 1);
        }
        return s;
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'' || c == '`';
    }

    /**
     * Pre-order walk over named nodes. Children of a node are visited only when
     * {@code visit} returns true for it. Iterative, so deep trees cannot
     * exhaust the stack.
     */
    static void walk(TSNode root, Predicate<TSNode> visit) {
        final Deque<TSNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            final TSNode node = stack.pop();
            if (!visit.test(node)) {
                continue;
            }
            final List<TSNode> children = namedChildren(node);
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
    }
}
