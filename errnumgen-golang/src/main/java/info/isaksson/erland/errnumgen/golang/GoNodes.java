package info.isaksson.erland.errnumgen.golang;

import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/** Small helpers over tree-sitter nodes. */
public final class GoNodes {

    private static final Set<String> KEYWORDS = Set.of(
            "break", "case", "chan", "const", "continue", "default", "defer", "else", "fallthrough", "for",
            "func", "go", "goto", "if", "import", "interface", "map", "package", "range", "return", "select",
            "struct", "switch", "type", "var");

    private GoNodes() {}

    /** Child under {@code name}, or null when absent. */
    public static TSNode field(TSNode node, String name) {
        if (node == null || node.isNull()) return null;
        TSNode child = node.getChildByFieldName(name);
        return child == null || child.isNull() ? null : child;
    }

    public static boolean is(TSNode node, String type) {
        return node != null && !node.isNull() && type.equals(node.getType());
    }

    /** Named children in source order, comments left out. */
    public static List<TSNode> namedChildren(TSNode node) {
        List<TSNode> out = new ArrayList<>();
        if (node == null || node.isNull()) return out;
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            TSNode child = node.getNamedChild(i);
            if (child == null || child.isNull() || GoNodeTypes.COMMENT.equals(child.getType())) continue;
            out.add(child);
        }
        return out;
    }

    /** True when an unnamed child of {@code node} has type {@code token}, e.g. {@code "..."}. */
    public static boolean hasToken(TSNode node, String token) {
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode child = node.getChild(i);
            if (child != null && !child.isNull() && !child.isNamed() && token.equals(child.getType())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Pre-order walk over named descendants of {@code root}, {@code root} included. The visitor returns
     * false to skip a node's children.
     */
    public static void walk(TSNode root, Predicate<TSNode> visitor) {
        if (root == null || root.isNull() || GoNodeTypes.COMMENT.equals(root.getType())) return;
        if (!visitor.test(root)) return;
        for (TSNode child : namedChildren(root)) {
            walk(child, visitor);
        }
    }

    /** True for the reserved words of Go. */
    public static boolean isKeyword(String word) {
        return KEYWORDS.contains(word);
    }
}
