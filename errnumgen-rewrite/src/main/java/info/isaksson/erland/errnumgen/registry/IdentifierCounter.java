package info.isaksson.erland.errnumgen.registry;

/**
 * Error number state for one run.
 *
 * <p>All numbers already used by wrapped expressions are recovered first; once the first new number has been
 * issued, recovery is closed. New numbers therefore always exceed every recovered one and follow each other
 * without gaps.</p>
 */
public final class IdentifierCounter {

    private int recovered;
    private int current;
    private boolean issuing;

    /** Records a number found in an already wrapped expression. */
    public void recover(int number) {
        if (issuing) {
            throw new IllegalStateException("cannot recover number " + number + " after issuing " + current);
        }
        if (number < 0) {
            throw new IllegalArgumentException("negative error number: " + number);
        }
        recovered = Math.max(recovered, number);
        current = recovered;
    }

    /** Issues the next number. */
    public int next() {
        issuing = true;
        current = Math.addExact(current, 1);
        return current;
    }

    /** Highest number in use: the last issued one, or the highest recovered one. */
    public int current() {
        return current;
    }

    /** Highest recovered number. */
    public int recovered() {
        return recovered;
    }

    /** Count of numbers issued by {@link #next()}. */
    public int issued() {
        return current - recovered;
    }
}
