package info.isaksson.erland.errnumgen.registry;

import info.isaksson.erland.errnumgen.discover.Classification;
import info.isaksson.erland.errnumgen.discover.DiscoveryWarnings;
import info.isaksson.erland.errnumgen.discover.EditClassifier;
import info.isaksson.erland.errnumgen.golang.GoNodeTypes;
import info.isaksson.erland.errnumgen.golang.GoNodes;
import info.isaksson.erland.errnumgen.load.SourceFile;
import info.isaksson.erland.errnumgen.rewrite.EditSynthesizer;
import org.treesitter.TSNode;

import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes expressions wrapped by an earlier run.
 *
 * <p>{@code <pkg>.New(<q>.<prefix><digits>, <inner>)} is already wrapped; its number is recovered into the
 * counter. Any other {@code <pkg>.New(...)} call is left alone with a warning, so nothing is wrapped twice.
 * Everything else is scheduled.</p>
 */
public final class RegistryClassifier implements EditClassifier {

    public static final String NON_CONFORMING = "non-conforming wrapper";

    private final String packageName;
    private final Pattern constant;
    private final IdentifierCounter counter;
    private final DiscoveryWarnings warnings;

    public RegistryClassifier(String packageName, String prefix, IdentifierCounter counter, DiscoveryWarnings warnings) {
        this.packageName = Objects.requireNonNull(packageName, "packageName");
        this.constant = Pattern.compile(Pattern.quote(prefix) + "([0-9]+)");
        this.counter = Objects.requireNonNull(counter, "counter");
        this.warnings = Objects.requireNonNull(warnings, "warnings");
    }

    @Override
    public Classification classify(SourceFile file, TSNode expr) {
        if (!isConstructorCall(file, expr)) {
            return Classification.schedule();
        }
        TSNode argList = GoNodes.field(expr, GoNodeTypes.FIELD_ARGUMENTS);
        List<TSNode> args = GoNodes.namedChildren(argList);
        if (args.size() == 2 && !hasEllipsis(argList, args) && isQualified(args.get(0))) {
            TSNode sel = GoNodes.field(args.get(0), GoNodeTypes.FIELD_FIELD);
            Matcher m = constant.matcher(file.slice(sel));
            int number = m.matches() ? parseNumber(m.group(1)) : -1;
            if (number >= 0) {
                counter.recover(number);
                return Classification.alreadyWrapped(number);
            }
        }
        int line = file.line(expr.getStartByte());
        warnings.warn(DiscoveryWarnings.NON_CONFORMING_WRAPPER,
                file.relativePath + ":" + line + " - " + packageName + "." + EditSynthesizer.CONSTRUCTOR
                        + " call without a generated error number: " + file.source(expr),
                "file", file.relativePath, "line", String.valueOf(line));
        return Classification.skip(NON_CONFORMING);
    }

    /** The number, or -1 when it does not fit an int. */
    private static int parseNumber(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private boolean isConstructorCall(SourceFile file, TSNode expr) {
        if (!GoNodes.is(expr, GoNodeTypes.CALL_EXPRESSION)) return false;
        TSNode fun = GoNodes.field(expr, GoNodeTypes.FIELD_FUNCTION);
        if (!isQualified(fun)) return false;
        return file.slice(GoNodes.field(fun, GoNodeTypes.FIELD_OPERAND)).equals(packageName)
                && file.slice(GoNodes.field(fun, GoNodeTypes.FIELD_FIELD)).equals(EditSynthesizer.CONSTRUCTOR);
    }

    /** {@code ident.name}, a selector on a bare identifier. */
    private static boolean isQualified(TSNode node) {
        return GoNodes.is(node, GoNodeTypes.SELECTOR_EXPRESSION)
                && GoNodes.is(GoNodes.field(node, GoNodeTypes.FIELD_OPERAND), GoNodeTypes.IDENTIFIER)
                && GoNodes.field(node, GoNodeTypes.FIELD_FIELD) != null;
    }

    private static boolean hasEllipsis(TSNode argList, List<TSNode> args) {
        for (TSNode a : args) {
            if (GoNodes.is(a, GoNodeTypes.VARIADIC_ARGUMENT)) return true;
        }
        return GoNodes.hasToken(argList, "...");
    }
}
