package info.isaksson.erland.errnumgen.load;

import java.nio.file.Path;

/** Thrown when a source root holds no Go declarations at all. */
public class NoSourceFoundException extends RuntimeException {

    public final Path root;

    public NoSourceFoundException(Path root) {
        super("no Go declarations found in " + root);
        this.root = root;
    }
}
