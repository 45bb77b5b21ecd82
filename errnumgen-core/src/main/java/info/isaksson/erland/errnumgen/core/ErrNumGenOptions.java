package info.isaksson.erland.errnumgen.core;

import info.isaksson.erland.errnumgen.golang.GoNodes;
import info.isaksson.erland.errnumgen.load.ContentReader;
import info.isaksson.erland.errnumgen.registry.RegistryOutputGenerator;
import info.isaksson.erland.errnumgen.rewrite.EditSynthesizer;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Options for an errnumgen run.
 *
 * <p>This mirrors the CLI flags in a structured form.</p>
 */
public final class ErrNumGenOptions {

    /** Package of the registry file; also the qualifier of generated wrappers. */
    public String outputPackage = EditSynthesizer.DEFAULT_PACKAGE;

    /** Registry file. When null, {@code <root>/<outputPackage>/errnums.go} is used. */
    public Path outputFile = null;

    /** Files and directories to leave untouched. The registry file is always skipped. */
    public List<Path> skipPaths = new ArrayList<>();

    public ContentReader reader = ContentReader.files();

    /**
     * Whether callers should only show the result. {@link ErrNumGenService} never writes either way; this is
     * for the committing caller.
     */
    public boolean dryRun = false;

    /** Whether callers committing the result keep a {@code .bkp} copy of each rewritten source. */
    public boolean backup = true;

    /** Absolute registry file path for {@code root}. */
    public Path resolveOutputFile(Path root) {
        Path out = outputFile != null
                ? outputFile
                : root.resolve(outputPackage).resolve(RegistryOutputGenerator.DEFAULT_FILE_NAME);
        return out.toAbsolutePath().normalize();
    }

    /** @throws IllegalArgumentException if the options cannot be used */
    public void validate() {
        if (!isGoIdentifier(outputPackage)) {
            throw new IllegalArgumentException("output package is not a valid Go package name: " + outputPackage);
        }
        if (reader == null) {
            throw new IllegalArgumentException("reader must not be null");
        }
    }

    static boolean isGoIdentifier(String name) {
        if (name == null || name.isEmpty() || name.equals("_")) return false;
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            boolean letter = Character.isLetter(c) || c == '_';
            if (!(letter || (i > 0 && Character.isDigit(c)))) return false;
        }
        return !GoNodes.isKeyword(name);
    }
}
