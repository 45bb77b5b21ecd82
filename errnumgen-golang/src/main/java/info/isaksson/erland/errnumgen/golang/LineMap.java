package info.isaksson.erland.errnumgen.golang;

import java.util.Arrays;

/** Resolves offsets into 1-based line and column numbers. */
public final class LineMap {

    private final int[] lineStarts;
    private final int length;

    private LineMap(int[] lineStarts, int length) {
        this.lineStarts = lineStarts;
        this.length = length;
    }

    public static LineMap of(CharSequence text) {
        int[] starts = new int[16];
        int n = 0;
        starts[n++] = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                if (n == starts.length) starts = Arrays.copyOf(starts, n * 2);
                starts[n++] = i + 1;
            }
        }
        return new LineMap(Arrays.copyOf(starts, n), text.length());
    }

    public int line(int offset) {
        checkOffset(offset);
        int idx = Arrays.binarySearch(lineStarts, offset);
        return idx >= 0 ? idx + 1 : -idx - 1;
    }

    public int column(int offset) {
        return offset - lineStarts[line(offset) - 1] + 1;
    }

    public int lineCount() {
        return lineStarts.length;
    }

    private void checkOffset(int offset) {
        if (offset < 0 || offset > length) {
            throw new IllegalArgumentException("offset out of range: " + offset + " (length " + length + ")");
        }
    }
}
