package info.isaksson.erland.errnumgen.load;

import java.util.List;

/** Thrown when one or more source files are malformed. Nothing is rewritten when this happens. */
public class SourceLoadException extends RuntimeException {

    /** One {@code file:line:column: message} entry per problem. */
    public final List<String> problems;

    /** Number of distinct malformed files. */
    public final int fileCount;

    public SourceLoadException(List<String> problems, int fileCount) {
        super(format(problems, fileCount));
        this.problems = List.copyOf(problems);
        this.fileCount = fileCount;
    }

    private static String format(List<String> problems, int fileCount) {
        StringBuilder sb = new StringBuilder();
        sb.append("failed to load ").append(fileCount).append(fileCount == 1 ? " file" : " files");
        for (String p : problems) {
            sb.append(System.lineSeparator()).append("  ").append(p);
        }
        return sb.toString();
    }
}
