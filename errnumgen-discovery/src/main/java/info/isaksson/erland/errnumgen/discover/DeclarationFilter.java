package info.isaksson.erland.errnumgen.discover;

import info.isaksson.erland.errnumgen.golang.GoNodeTypes;
import info.isaksson.erland.errnumgen.golang.GoNodes;
import info.isaksson.erland.errnumgen.load.CompilationUnit;
import info.isaksson.erland.errnumgen.load.SourceFile;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Narrows a unit to the function declarations that return an {@code error}.
 *
 * <p>A result counts only when its type is the bare identifier {@code error}; named error types, qualified
 * types and pointers do not. Functions without a body are dropped as well.</p>
 */
public final class DeclarationFilter {

    public static final String ERROR_TYPE = "error";

    private DeclarationFilter() {}

    /** Files of {@code unit} with at least one retained declaration, in unit order. */
    public static List<RetainedFile> filter(CompilationUnit unit) {
        List<RetainedFile> out = new ArrayList<>();
        for (SourceFile f : unit.files) {
            List<TSNode> kept = new ArrayList<>();
            for (TSNode d : f.declarations()) {
                if (isFunction(d) && GoNodes.field(d, GoNodeTypes.FIELD_BODY) != null && returnsError(f, d)) {
                    kept.add(d);
                }
            }
            if (!kept.isEmpty()) {
                out.add(new RetainedFile(f, kept));
            }
        }
        return out;
    }

    /** Function or method declaration. */
    public static boolean isFunction(TSNode node) {
        return GoNodes.is(node, GoNodeTypes.FUNCTION_DECLARATION) || GoNodes.is(node, GoNodeTypes.METHOD_DECLARATION);
    }

    public static boolean returnsError(SourceFile file, TSNode fn) {
        return errorResultIndex(file, fn) >= 0;
    }

    /**
     * Zero-based slot of the first {@code error} result of a function, method or function literal, or -1. A
     * result declaring several names occupies one slot per name.
     */
    public static int errorResultIndex(SourceFile file, TSNode fn) {
        TSNode result = GoNodes.field(fn, GoNodeTypes.FIELD_RESULT);
        if (result == null) return -1;
        if (!GoNodes.is(result, GoNodeTypes.PARAMETER_LIST)) {
            return isErrorType(file, result) ? 0 : -1;
        }
        int slot = 0;
        for (TSNode p : GoNodes.namedChildren(result)) {
            if (isErrorType(file, GoNodes.field(p, GoNodeTypes.FIELD_TYPE))) {
                return slot;
            }
            slot += slotCount(p);
        }
        return -1;
    }

    /** Number of declared results, counting every name of a grouped result. */
    public static int resultCount(TSNode fn) {
        TSNode result = GoNodes.field(fn, GoNodeTypes.FIELD_RESULT);
        if (result == null) return 0;
        if (!GoNodes.is(result, GoNodeTypes.PARAMETER_LIST)) return 1;
        int n = 0;
        for (TSNode p : GoNodes.namedChildren(result)) {
            n += slotCount(p);
        }
        return n;
    }

    private static int slotCount(TSNode param) {
        int names = 0;
        for (TSNode c : GoNodes.namedChildren(param)) {
            if (GoNodes.is(c, GoNodeTypes.IDENTIFIER)) names++;
        }
        return Math.max(1, names);
    }

    private static boolean isErrorType(SourceFile file, TSNode type) {
        return GoNodes.is(type, GoNodeTypes.TYPE_IDENTIFIER) && file.slice(type).equals(ERROR_TYPE);
    }
}
