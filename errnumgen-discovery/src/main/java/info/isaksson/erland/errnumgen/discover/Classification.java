package info.isaksson.erland.errnumgen.discover;

/** Outcome of classifying one error expression. */
public final class Classification {

    public enum Kind {
        /** Already wrapped by an earlier run; {@link #number} holds its identifier. */
        SKIP_ALREADY_WRAPPED,
        /** Left alone for another reason, given in {@link #reason}. */
        SKIP_OTHER,
        /** To be wrapped. */
        SCHEDULE
    }

    private static final Classification SCHEDULE = new Classification(Kind.SCHEDULE, 0, null);

    public final Kind kind;
    public final int number;
    public final String reason;

    private Classification(Kind kind, int number, String reason) {
        this.kind = kind;
        this.number = number;
        this.reason = reason;
    }

    public static Classification schedule() {
        return SCHEDULE;
    }

    public static Classification alreadyWrapped(int number) {
        return new Classification(Kind.SKIP_ALREADY_WRAPPED, number, null);
    }

    public static Classification skip(String reason) {
        return new Classification(Kind.SKIP_OTHER, 0, reason);
    }

    @Override
    public String toString() {
        switch (kind) {
            case SKIP_ALREADY_WRAPPED: return kind + "(" + number + ")";
            case SKIP_OTHER: return kind + "(" + reason + ")";
            default: return kind.toString();
        }
    }
}
