package info.isaksson.erland.errnumgen.discover;

import info.isaksson.erland.errnumgen.golang.GoNodeTypes;
import info.isaksson.erland.errnumgen.golang.GoNodes;
import info.isaksson.erland.errnumgen.load.SourceFile;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Finds the expression returned in the error slot of every return statement.
 *
 * <p>Function bodies are walked depth-first in source order. A function literal is analysed against its own
 * result list, never the enclosing one. Return statements whose value count does not match the declared
 * result count (a bare {@code return}, or a call forwarding all results) are reported as warnings and left
 * alone, as are {@code nil} values. Everything else is passed to the {@link EditClassifier}.</p>
 *
 * <p>The expression in the error slot is never searched, whatever its classification: once wrapped it is
 * seen as already wrapped, so searching it would find candidates a previous run did not. Function literals
 * in the other slots are analysed.</p>
 */
public final class ErrorNodeFinder {

    private final EditClassifier classifier;
    private final DiscoveryWarnings warnings;

    private final List<ErrorExpression> scheduled = new ArrayList<>();
    private final List<ErrorExpression> alreadyWrapped = new ArrayList<>();
    private final List<ErrorExpression> skipped = new ArrayList<>();

    public ErrorNodeFinder(EditClassifier classifier, DiscoveryWarnings warnings) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.warnings = Objects.requireNonNull(warnings, "warnings");
    }

    /**
     * Discover the error expressions of all retained files.
     *
     * @throws StructuralAssumptionException if a retained declaration is not a function with a body
     */
    public Discovery find(List<RetainedFile> files) {
        scheduled.clear();
        alreadyWrapped.clear();
        skipped.clear();
        for (RetainedFile rf : files) {
            for (TSNode d : rf.decls) {
                if (!DeclarationFilter.isFunction(d) || GoNodes.field(d, GoNodeTypes.FIELD_BODY) == null) {
                    throw new StructuralAssumptionException(rf.file.position(d.getStartByte())
                            + ": expected a function declaration with a body, found " + describe(rf.file, d));
                }
                function(rf.file, d);
            }
        }
        return new Discovery(scheduled, alreadyWrapped, skipped);
    }

    private void function(SourceFile file, TSNode fn) {
        int errorSlot = DeclarationFilter.errorResultIndex(file, fn);
        int declared = DeclarationFilter.resultCount(fn);
        TSNode body = GoNodes.field(fn, GoNodeTypes.FIELD_BODY);
        for (TSNode s : GoNodes.namedChildren(body)) {
            walk(file, s, errorSlot, declared);
        }
    }

    private void walk(SourceFile file, TSNode root, int errorSlot, int declared) {
        GoNodes.walk(root, n -> {
            if (GoNodes.is(n, GoNodeTypes.FUNC_LITERAL)) {
                function(file, n);
                return false;
            }
            if (GoNodes.is(n, GoNodeTypes.RETURN_STATEMENT)) {
                returnStmt(file, n, errorSlot, declared);
                return false;
            }
            return true;
        });
    }

    private void returnStmt(SourceFile file, TSNode ret, int errorSlot, int declared) {
        List<TSNode> results = results(ret);
        if (errorSlot < 0) {
            walkAll(file, results, errorSlot, declared);
            return;
        }
        if (results.size() != declared) {
            int line = file.line(ret.getStartByte());
            warnings.warn(DiscoveryWarnings.UNEXPECTED_RESULT_ARITY,
                    file.relativePath + ":" + line + " - unexpected number of returned values: "
                            + results.size() + "/" + declared,
                    "file", file.relativePath, "line", String.valueOf(line));
            walkAll(file, results, errorSlot, declared);
            return;
        }

        for (int i = 0; i < results.size(); i++) {
            TSNode result = results.get(i);
            if (i != errorSlot) {
                walk(file, result, errorSlot, declared);
                continue;
            }
            if (GoNodes.is(result, GoNodeTypes.NIL)) {
                continue;
            }
            Classification c = Objects.requireNonNull(classifier.classify(file, result), "classification");
            ErrorExpression e = new ErrorExpression(file, result, c);
            switch (c.kind) {
                case SCHEDULE -> scheduled.add(e);
                case SKIP_ALREADY_WRAPPED -> alreadyWrapped.add(e);
                case SKIP_OTHER -> skipped.add(e);
            }
        }
    }

    private static List<TSNode> results(TSNode ret) {
        for (TSNode c : GoNodes.namedChildren(ret)) {
            if (GoNodes.is(c, GoNodeTypes.EXPRESSION_LIST)) {
                return GoNodes.namedChildren(c);
            }
        }
        return List.of();
    }

    private void walkAll(SourceFile file, List<TSNode> exprs, int errorSlot, int declared) {
        for (TSNode x : exprs) {
            walk(file, x, errorSlot, declared);
        }
    }

    private static String describe(SourceFile file, TSNode d) {
        TSNode name = GoNodes.field(d, GoNodeTypes.FIELD_NAME);
        if (DeclarationFilter.isFunction(d) && name != null) {
            return "function " + file.source(name) + " without a body";
        }
        return d.getType();
    }
}
