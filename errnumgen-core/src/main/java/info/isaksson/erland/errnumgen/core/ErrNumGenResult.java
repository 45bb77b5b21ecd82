package info.isaksson.erland.errnumgen.core;

import info.isaksson.erland.errnumgen.discover.DiscoveryWarning;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Result of one run, computed fully in memory. Nothing has been written when this is returned. */
public final class ErrNumGenResult {

    /** New content of every rewritten source file, in unit and file order. */
    public final Map<Path, byte[]> updatedSources;

    /** Absolute path of the registry file. */
    public final Path outputPath;

    /** Registry file content. */
    public final String outputContent;

    public final String outputPackage;

    /** Wrapped expressions in numbering order. */
    public final List<AppliedEdit> edits;

    /** Count of expressions found already wrapped. */
    public final int alreadyWrapped;

    /** Highest number recovered from already wrapped expressions. */
    public final int recoveredMax;

    /** Highest number in use after this run; the registry declares 1 through this. */
    public final int counter;

    public final List<DiscoveryWarning> warnings;

    public final int unitCount;
    public final int fileCount;

    ErrNumGenResult(
            Map<Path, byte[]> updatedSources,
            Path outputPath,
            String outputContent,
            String outputPackage,
            List<AppliedEdit> edits,
            int alreadyWrapped,
            int recoveredMax,
            int counter,
            List<DiscoveryWarning> warnings,
            int unitCount,
            int fileCount
    ) {
        this.updatedSources = Collections.unmodifiableMap(new LinkedHashMap<>(updatedSources));
        this.outputPath = outputPath;
        this.outputContent = outputContent;
        this.outputPackage = outputPackage;
        this.edits = List.copyOf(edits);
        this.alreadyWrapped = alreadyWrapped;
        this.recoveredMax = recoveredMax;
        this.counter = counter;
        this.warnings = List.copyOf(warnings);
        this.unitCount = unitCount;
        this.fileCount = fileCount;
    }

    /** UTF-8 encoded registry file. */
    public byte[] outputBytes() {
        return outputContent.getBytes(StandardCharsets.UTF_8);
    }

    /** Updated content of a source file decoded as UTF-8, for display. */
    public String updatedText(Path path) {
        byte[] b = updatedSources.get(path);
        return b == null ? null : new String(b, StandardCharsets.UTF_8);
    }
}
