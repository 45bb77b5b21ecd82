package info.isaksson.erland.errnumgen.discover;

/** Thrown when discovery meets a declaration shape that filtering should have ruled out. */
public class StructuralAssumptionException extends RuntimeException {

    public StructuralAssumptionException(String message) {
        super(message);
    }
}
