package info.isaksson.erland.errnumgen.golang;

import org.treesitter.TSNode;
import org.treesitter.TSTree;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * A parsed Go text: the tree-sitter tree and the UTF-8 bytes it was built from.
 *
 * <p>Node offsets are byte offsets into {@link #length()} bytes of UTF-8.</p>
 */
public final class GoSyntax {

    private final TSTree tree;
    private final byte[] utf8;

    GoSyntax(TSTree tree, byte[] utf8) {
        this.tree = tree;
        this.utf8 = utf8;
    }

    public TSNode root() {
        return tree.getRootNode();
    }

    public int length() {
        return utf8.length;
    }

    public boolean hasError() {
        return root().hasError();
    }

    /** Source text of a node. */
    public String text(TSNode node) {
        return new String(utf8, node.getStartByte(), node.getEndByte() - node.getStartByte(), StandardCharsets.UTF_8);
    }

    /** Top-level declarations, the package clause left out. */
    public List<TSNode> declarations() {
        List<TSNode> out = GoNodes.namedChildren(root());
        out.removeIf(n -> GoNodeTypes.PACKAGE_CLAUSE.equals(n.getType()));
        return out;
    }

    /** The leading package clause when it is well-formed, otherwise null. */
    public TSNode packageClause() {
        List<TSNode> top = GoNodes.namedChildren(root());
        if (top.isEmpty()) return null;
        TSNode first = top.get(0);
        if (!GoNodes.is(first, GoNodeTypes.PACKAGE_CLAUSE) || first.hasError()) return null;
        return packageIdentifier(first) == null ? null : first;
    }

    public String packageName() {
        TSNode clause = packageClause();
        if (clause == null) throw new IllegalStateException("no package clause");
        return text(packageIdentifier(clause));
    }

    /** Byte offset of the package name. */
    public int packageNameOffset() {
        TSNode clause = packageClause();
        if (clause == null) throw new IllegalStateException("no package clause");
        return packageIdentifier(clause).getStartByte();
    }

    /** Throws at the first syntax error, if any. */
    public GoSyntax requireWellFormed() {
        GoSyntaxException e = firstError();
        if (e != null) throw e;
        return this;
    }

    /** Throws unless the leading package clause is well-formed; the rest of the text is not checked. */
    public GoSyntax requirePackageClause() {
        if (packageClause() != null) return this;
        GoSyntaxException e = firstError();
        throw e != null ? e : new GoSyntaxException(0, "expected 'package' clause");
    }

    /** The first syntax error in source order, or null for a well-formed text. */
    public GoSyntaxException firstError() {
        TSNode root = root();
        if (!root.hasError()) return null;
        GoSyntaxException found = firstError(root);
        return found != null ? found : new GoSyntaxException(root.getStartByte(), "syntax error");
    }

    private GoSyntaxException firstError(TSNode node) {
        if (node.isMissing()) {
            return new GoSyntaxException(node.getStartByte(), "missing " + describe(node.getType()));
        }
        if (GoNodeTypes.ERROR.equals(node.getType())) {
            return new GoSyntaxException(node.getStartByte(), "unexpected " + snippet(node));
        }
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode child = node.getChild(i);
            if (child == null || child.isNull()) continue;
            if (child.isMissing() || child.hasError()) {
                GoSyntaxException e = firstError(child);
                if (e != null) return e;
            }
        }
        return null;
    }

    private String snippet(TSNode node) {
        String s = text(node).strip();
        int nl = s.indexOf('\n');
        if (nl >= 0) s = s.substring(0, nl).strip();
        if (s.length() > 24) s = s.substring(0, 24) + "...";
        return s.isEmpty() ? "end of input" : "'" + s + "'";
    }

    private static String describe(String type) {
        boolean word = !type.isEmpty() && type.chars().allMatch(c -> Character.isLetter(c) || c == '_');
        return word ? type : "'" + type + "'";
    }

    private static TSNode packageIdentifier(TSNode clause) {
        for (TSNode n : GoNodes.namedChildren(clause)) {
            if (GoNodeTypes.PACKAGE_IDENTIFIER.equals(n.getType())) return n;
        }
        return null;
    }
}
