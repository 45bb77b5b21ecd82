package info.isaksson.erland.errnumgen.load;

import info.isaksson.erland.errnumgen.golang.GoParser;
import info.isaksson.erland.errnumgen.golang.GoSyntax;
import info.isaksson.erland.errnumgen.golang.GoSyntaxException;
import info.isaksson.erland.errnumgen.golang.LineMap;
import info.isaksson.erland.errnumgen.io.SourceScanner;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Loads every Go package below a root directory.
 *
 * <p>Files are grouped by directory into {@link CompilationUnit}s and parsed with tree-sitter. Content must be
 * UTF-8. A file that does not mention both {@code return} and {@code error} cannot hold an error return; only
 * its package clause has to be well-formed and its declarations are ignored. All files are checked before
 * anything is returned, so a single malformed file fails the whole load.</p>
 */
public final class SourceLoader {

    private final ContentReader reader;

    public SourceLoader() {
        this(ContentReader.files());
    }

    public SourceLoader(ContentReader reader) {
        this.reader = Objects.requireNonNull(reader, "reader");
    }

    /**
     * Load all packages under {@code root}.
     *
     * @param root source root
     * @param skipPaths files or directories to leave out
     * @return units sorted by directory, the root directory first
     * @throws SourceLoadException if any file is malformed or a directory mixes package names
     * @throws NoSourceFoundException if no file declares anything
     */
    public List<CompilationUnit> load(Path root, List<Path> skipPaths) throws IOException {
        Objects.requireNonNull(root, "root");
        final Path absRoot = root.toAbsolutePath().normalize();
        if (!Files.isDirectory(absRoot)) {
            throw new IOException("not a directory: " + absRoot);
        }

        Map<Path, List<Path>> byDir = new LinkedHashMap<>();
        for (Path p : SourceScanner.scan(absRoot, skipPaths)) {
            byDir.computeIfAbsent(p.getParent(), d -> new ArrayList<>()).add(p);
        }

        GoParser parser = new GoParser();
        List<String> problems = new ArrayList<>();
        int malformed = 0;
        List<CompilationUnit> units = new ArrayList<>();
        for (Map.Entry<Path, List<Path>> e : byDir.entrySet()) {
            Path dir = e.getKey();
            List<SourceFile> files = new ArrayList<>();
            for (Path p : e.getValue()) {
                String rel = SourceScanner.normalizeRel(absRoot, p);
                byte[] content = read(p);
                try {
                    files.add(parse(parser, p, rel, content));
                } catch (GoSyntaxException ex) {
                    LineMap lines = LineMap.of(SourceFile.decode(content));
                    problems.add(rel + ":" + lines.line(ex.offset) + ":" + lines.column(ex.offset) + ": " + ex.detail);
                    malformed++;
                }
            }
            if (files.isEmpty()) continue;

            SourceFile first = files.get(0);
            boolean mixed = false;
            for (SourceFile f : files) {
                if (!f.packageName().equals(first.packageName())) {
                    problems.add(f.position(f.syntax.packageNameOffset()) + ": package " + f.packageName()
                            + "; expected " + first.packageName() + " (from " + first.relativePath + ")");
                    mixed = true;
                }
            }
            if (mixed) {
                malformed++;
                continue;
            }
            String relDir = relativeDirectory(absRoot, dir);
            units.add(new CompilationUnit(dir, relDir, first.packageName(), files));
        }

        if (!problems.isEmpty()) {
            throw new SourceLoadException(problems, malformed);
        }

        units.sort(Comparator
                .comparing((CompilationUnit u) -> !u.relativeDirectory.equals("."))
                .thenComparing(u -> u.relativeDirectory));

        int declarations = 0;
        for (CompilationUnit u : units) declarations += u.declarationCount();
        if (declarations == 0) {
            throw new NoSourceFoundException(absRoot);
        }
        return units;
    }

    /** Parses one file; files that cannot hold an error return only need a well-formed package clause. */
    static SourceFile parse(GoParser parser, Path path, String relativePath, byte[] content) {
        String source = decodeUtf8(content);
        boolean full = mayContainErrorReturn(source);
        GoSyntax syntax = full ? parser.parseFile(source) : parser.parse(source).requirePackageClause();
        return new SourceFile(path, relativePath, content, syntax, full);
    }

    static String decodeUtf8(byte[] content) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        ByteBuffer in = ByteBuffer.wrap(content);
        CharBuffer out = CharBuffer.allocate(content.length);
        CoderResult r = decoder.decode(in, out, true);
        if (r.isError()) {
            throw new GoSyntaxException(in.position(), "invalid UTF-8 encoding");
        }
        decoder.flush(out);
        out.flip();
        return out.toString();
    }

    static boolean mayContainErrorReturn(String text) {
        return text.contains("return") && text.contains("error");
    }

    private byte[] read(Path p) throws IOException {
        try {
            return reader.read(p);
        } catch (IOException e) {
            throw new IOException("failed to read " + p + ": " + e.getMessage(), e);
        }
    }

    private static String relativeDirectory(Path root, Path dir) {
        String rel = SourceScanner.normalizeRel(root, dir);
        return rel.isEmpty() ? "." : rel;
    }
}
