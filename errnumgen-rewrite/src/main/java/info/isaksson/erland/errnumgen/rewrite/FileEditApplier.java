package info.isaksson.erland.errnumgen.rewrite;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Splices edits into the original bytes of a file.
 *
 * <p>Edit offsets always refer to the original content. Edits are applied from the highest start offset to
 * the lowest, so the bytes before each pending edit are still untouched when it is applied.</p>
 */
public final class FileEditApplier {

    private FileEditApplier() {}

    /**
     * @throws IllegalStateException if two edits overlap or an edit lies outside the content
     */
    public static byte[] apply(byte[] original, List<Edit> edits) {
        List<Edit> sorted = new ArrayList<>(edits);
        sorted.sort(Comparator.comparingInt((Edit e) -> e.start).thenComparingInt(e -> e.end));

        for (int i = 0; i < sorted.size(); i++) {
            Edit e = sorted.get(i);
            if (e.end > original.length) {
                throw new IllegalStateException("edit " + e + " exceeds content length " + original.length);
            }
            if (i + 1 < sorted.size() && e.end > sorted.get(i + 1).start) {
                throw new IllegalStateException("overlapping edits: " + e + " and " + sorted.get(i + 1));
            }
        }

        byte[] buf = original.clone();
        for (int i = sorted.size() - 1; i >= 0; i--) {
            Edit e = sorted.get(i);
            buf = splice(buf, e.start, e.end, e.replacementBytes());
        }
        return buf;
    }

    /** {@code content[0:start] + replacement + content[end:]}. */
    static byte[] splice(byte[] content, int start, int end, byte[] replacement) {
        byte[] out = new byte[content.length - (end - start) + replacement.length];
        System.arraycopy(content, 0, out, 0, start);
        System.arraycopy(replacement, 0, out, start, replacement.length);
        System.arraycopy(content, end, out, start + replacement.length, content.length - end);
        return out;
    }
}
