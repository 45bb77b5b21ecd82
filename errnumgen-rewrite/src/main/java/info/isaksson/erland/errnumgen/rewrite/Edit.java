package info.isaksson.erland.errnumgen.rewrite;

import java.nio.charset.StandardCharsets;

/**
 * Replacement of the half-open byte range {@code [start, end)} of one file.
 *
 * <p>{@link #replacement} holds one char per byte (ISO-8859-1), like the loaded source text, so replacements
 * built from slices of the original text keep its exact bytes.</p>
 */
public final class Edit {
    public final int start;
    public final int end;
    public final String replacement;

    public Edit(int start, int end, String replacement) {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("invalid edit range [" + start + ", " + end + ")");
        }
        this.start = start;
        this.end = end;
        this.replacement = replacement;
    }

    public byte[] replacementBytes() {
        return replacement.getBytes(StandardCharsets.ISO_8859_1);
    }

    /** Replacement decoded as UTF-8, for display. */
    public String replacementText() {
        return new String(replacementBytes(), StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ") -> " + replacementText();
    }
}
