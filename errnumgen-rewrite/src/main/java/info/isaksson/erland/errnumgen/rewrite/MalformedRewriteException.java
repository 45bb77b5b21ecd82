package info.isaksson.erland.errnumgen.rewrite;

/** Thrown when a synthesized replacement does not parse as a Go expression. */
public class MalformedRewriteException extends RuntimeException {

    public final String replacement;

    public MalformedRewriteException(String position, String replacement, Throwable cause) {
        super(position + ": failed to parse rewritten expression: " + cause.getMessage()
                + System.lineSeparator() + replacement, cause);
        this.replacement = replacement;
    }
}
