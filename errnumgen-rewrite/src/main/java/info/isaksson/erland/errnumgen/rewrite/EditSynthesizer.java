package info.isaksson.erland.errnumgen.rewrite;

import info.isaksson.erland.errnumgen.discover.ErrorExpression;
import info.isaksson.erland.errnumgen.golang.GoParser;
import info.isaksson.erland.errnumgen.golang.GoSyntaxException;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Builds the wrapping edit for a scheduled error expression:
 * {@code <pkg>.New(<pkg>.<prefix><id>, <original>)}.
 *
 * <p>The original text is copied verbatim. Every replacement is parsed back before it is accepted. An instance
 * holds a native parser and is not thread-safe.</p>
 */
public final class EditSynthesizer {

    public static final String DEFAULT_PACKAGE = "errnums";
    public static final String DEFAULT_PREFIX = "N_";
    public static final String CONSTRUCTOR = "New";

    private final String packageName;
    private final String prefix;
    private final GoParser parser = new GoParser();

    public EditSynthesizer(String packageName) {
        this(packageName, DEFAULT_PREFIX);
    }

    public EditSynthesizer(String packageName, String prefix) {
        this.packageName = Objects.requireNonNull(packageName, "packageName");
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    /**
     * @throws MalformedRewriteException if the replacement is not a well-formed expression
     */
    public Edit synthesize(ErrorExpression expr, int id) {
        String text = wrap(expr.file.slice(expr.expr), id);
        String display = new String(text.getBytes(StandardCharsets.ISO_8859_1), StandardCharsets.UTF_8);
        try {
            parser.checkExpression(display);
        } catch (GoSyntaxException e) {
            throw new MalformedRewriteException(expr.file.position(expr.start()), display, e);
        }
        return new Edit(expr.start(), expr.end(), text);
    }

    public String wrap(String original, int id) {
        return packageName + "." + CONSTRUCTOR + "(" + packageName + "." + prefix + id + ", " + original + ")";
    }
}
