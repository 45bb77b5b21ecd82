package info.isaksson.erland.errnumgen.golang;

/**
 * Thrown when Go source text is not syntactically well-formed.
 *
 * <p>{@link #offset} is the offset of the offending token in the parsed text; callers that know the
 * file use it to resolve a line and column.</p>
 */
public class GoSyntaxException extends RuntimeException {

    public final int offset;
    public final String detail;

    public GoSyntaxException(int offset, String detail) {
        super("offset " + offset + ": " + detail);
        this.offset = offset;
        this.detail = detail;
    }
}
