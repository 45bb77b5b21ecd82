package info.isaksson.erland.errnumgen.load;

import java.nio.file.Path;
import java.util.List;

/** The Go files of one directory, parsed together as one package. */
public final class CompilationUnit {

    public final Path directory;

    /** Directory relative to the scanned root ("." for the root itself). */
    public final String relativeDirectory;

    public final String packageName;
    public final List<SourceFile> files;

    public CompilationUnit(Path directory, String relativeDirectory, String packageName, List<SourceFile> files) {
        this.directory = directory;
        this.relativeDirectory = relativeDirectory;
        this.packageName = packageName;
        this.files = List.copyOf(files);
    }

    public int declarationCount() {
        int n = 0;
        for (SourceFile f : files) n += f.declarations().size();
        return n;
    }

    @Override
    public String toString() {
        return relativeDirectory + " (package " + packageName + ", " + files.size() + " files)";
    }
}
