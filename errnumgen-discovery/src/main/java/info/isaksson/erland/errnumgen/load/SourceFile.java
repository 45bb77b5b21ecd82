package info.isaksson.erland.errnumgen.load;

import info.isaksson.erland.errnumgen.golang.GoSyntax;
import info.isaksson.erland.errnumgen.golang.LineMap;
import org.treesitter.TSNode;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * One loaded Go file: its original bytes and syntax tree.
 *
 * <p>The text is the content decoded as ISO-8859-1, one char per byte, so every byte offset in the syntax tree
 * is also an index into {@link #text}.</p>
 */
public final class SourceFile {

    /** Absolute, normalized path. */
    public final Path path;

    /** Path relative to the scanned root, with '/' separators. */
    public final String relativePath;

    public final String text;
    public final GoSyntax syntax;

    /** False when only the package clause was checked because the file cannot hold an error return. */
    public final boolean fullyParsed;

    private final byte[] content;
    private final LineMap lines;

    public SourceFile(Path path, String relativePath, byte[] content, GoSyntax syntax, boolean fullyParsed) {
        this.path = path;
        this.relativePath = relativePath;
        this.content = content.clone();
        this.text = decode(content);
        this.syntax = syntax;
        this.fullyParsed = fullyParsed;
        this.lines = LineMap.of(text);
    }

    static String decode(byte[] content) {
        return new String(content, StandardCharsets.ISO_8859_1);
    }

    /** Copy of the original bytes. */
    public byte[] content() {
        return Arrays.copyOf(content, content.length);
    }

    public int length() {
        return content.length;
    }

    /** Top-level declarations; empty for a file that was not fully parsed. */
    public List<TSNode> declarations() {
        return fullyParsed ? syntax.declarations() : List.of();
    }

    /** Byte-per-char view of a node's source range; encoding it as ISO-8859-1 gives back the exact bytes. */
    public String slice(TSNode node) {
        return text.substring(node.getStartByte(), node.getEndByte());
    }

    /** Source text of a node decoded as UTF-8, for display. */
    public String source(TSNode node) {
        int start = node.getStartByte();
        return new String(content, start, node.getEndByte() - start, StandardCharsets.UTF_8);
    }

    public int line(int offset) {
        return lines.line(offset);
    }

    public int column(int offset) {
        return lines.column(offset);
    }

    /** {@code relativePath:line:column} of an offset. */
    public String position(int offset) {
        return relativePath + ":" + line(offset) + ":" + column(offset);
    }

    public String packageName() {
        return syntax.packageName();
    }

    @Override
    public String toString() {
        return relativePath;
    }
}
