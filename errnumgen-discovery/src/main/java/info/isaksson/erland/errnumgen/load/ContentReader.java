package info.isaksson.erland.errnumgen.load;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Reads the raw bytes of a source file. */
@FunctionalInterface
public interface ContentReader {

    byte[] read(Path path) throws IOException;

    static ContentReader files() {
        return Files::readAllBytes;
    }
}
