package info.isaksson.erland.errnumgen.golang;

import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterGo;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * Parses Go text with the tree-sitter Go grammar.
 *
 * <p>Offsets of the resulting nodes are UTF-8 byte offsets. A byte order mark at the start of the text is
 * accepted and kept out of the tree. One instance holds one native parser and is not thread-safe.</p>
 */
public final class GoParser {

    static final char BYTE_ORDER_MARK = '\uFEFF';

    /** Three spaces: the UTF-8 length of the byte order mark. */
    private static final String BOM_PADDING = "   ";

    private static final String EXPRESSION_PREFIX = "package p\n\nvar _ = ";

    private final TSParser parser;

    public GoParser() {
        this.parser = new TSParser();
        parser.setLanguage(new TreeSitterGo());
    }

    /** Parses {@code source}; the result may hold syntax errors. */
    public GoSyntax parse(String source) {
        Objects.requireNonNull(source, "source");
        String masked = !source.isEmpty() && source.charAt(0) == BYTE_ORDER_MARK
                ? BOM_PADDING + source.substring(1)
                : source;
        TSTree tree = Objects.requireNonNull(parser.parseString(null, masked), "tree-sitter returned no tree");
        return new GoSyntax(tree, masked.getBytes(StandardCharsets.UTF_8));
    }

    /** Parses a complete source file: well-formed and starting with a package clause. */
    public GoSyntax parseFile(String source) {
        return parse(source).requireWellFormed().requirePackageClause();
    }

    /**
     * Checks that {@code expression} is exactly one well-formed Go expression.
     *
     * @throws GoSyntaxException with an offset into {@code expression}
     */
    public void checkExpression(String expression) {
        String wrapped = EXPRESSION_PREFIX + expression + "\n";
        int prefix = EXPRESSION_PREFIX.getBytes(StandardCharsets.UTF_8).length;
        GoSyntax syntax = parse(wrapped);
        GoSyntaxException e = syntax.firstError();
        if (e != null) {
            throw new GoSyntaxException(Math.max(0, e.offset - prefix), e.detail);
        }
        List<TSNode> decls = syntax.declarations();
        TSNode spec = decls.size() == 1 && GoNodes.is(decls.get(0), GoNodeTypes.VAR_DECLARATION)
                ? firstSpec(decls.get(0))
                : null;
        TSNode value = GoNodes.field(spec, GoNodeTypes.FIELD_VALUE);
        if (value == null) {
            throw new GoSyntaxException(0, "expected an expression");
        }
        if (GoNodes.is(value, GoNodeTypes.EXPRESSION_LIST)) {
            List<TSNode> values = GoNodes.namedChildren(value);
            if (values.size() != 1) {
                throw new GoSyntaxException(values.size() > 1 ? values.get(1).getStartByte() - prefix : 0,
                        "expected a single expression, found " + values.size());
            }
        }
    }

    private static TSNode firstSpec(TSNode decl) {
        TSNode[] found = new TSNode[1];
        GoNodes.walk(decl, n -> {
            if (found[0] != null) return false;
            if (GoNodes.is(n, GoNodeTypes.VAR_SPEC)) {
                found[0] = n;
                return false;
            }
            return true;
        });
        return found[0];
    }
}
