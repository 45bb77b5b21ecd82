package info.isaksson.erland.errnumgen.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Deterministic Go source discovery with skip rules.
 *
 * <p>The scanner returns a stable, sorted list of .go files under a source root, following what the Go
 * tool matches for {@code ./...}: test files, {@code testdata} and {@code vendor} directories, names starting
 * with '.' or '_', and nested modules (directories with their own go.mod) are left out.</p>
 */
public final class SourceScanner {

    private SourceScanner() {}

    /**
     * Scan for .go files under {@code sourceRoot}.
     *
     * @param sourceRoot root folder to scan
     * @param skipPaths files or directories to leave out; a path is skipped when it equals or lies below one
     *                  of them
     */
    public static List<Path> scan(Path sourceRoot, List<Path> skipPaths) throws IOException {
        Objects.requireNonNull(sourceRoot, "sourceRoot");
        final Path root = sourceRoot.toAbsolutePath().normalize();
        final List<Path> skips = normalizeAll(skipPaths);
        final Map<Path, Boolean> moduleRoots = new HashMap<>();

        try (Stream<Path> stream = Files.walk(root)) {
            List<Path> out = new ArrayList<>();
            stream
                .filter(Files::isRegularFile)
                .filter(p -> isGoSource(p.getFileName().toString()))
                .filter(p -> !isInIgnoredDir(root, p))
                .filter(p -> !isInNestedModule(root, p, moduleRoots))
                .filter(p -> !isSkipped(p, skips))
                .forEach(out::add);

            // Stable deterministic ordering (relative path)
            out.sort(Comparator.comparing(p -> normalizeRel(root, p)));
            return out;
        }
    }

    /** True for {@code x.go}, false for {@code x_test.go} and hidden or underscore-prefixed names. */
    static boolean isGoSource(String fileName) {
        return fileName.endsWith(".go")
                && !fileName.endsWith("_test.go")
                && !isIgnoredName(fileName);
    }

    private static boolean isIgnoredName(String name) {
        return name.startsWith(".") || name.startsWith("_");
    }

    private static boolean isInIgnoredDir(Path root, Path file) {
        Path rel = root.relativize(file.getParent());
        for (Path part : rel) {
            String name = part.toString();
            if (name.isEmpty()) continue;
            if (isIgnoredName(name) || name.equals("testdata") || name.equals("vendor")) return true;
        }
        return false;
    }

    private static boolean isInNestedModule(Path root, Path file, Map<Path, Boolean> moduleRoots) {
        for (Path dir = file.getParent(); dir != null && !dir.equals(root) && dir.startsWith(root); dir = dir.getParent()) {
            boolean module = moduleRoots.computeIfAbsent(dir, d -> Files.isRegularFile(d.resolve("go.mod")));
            if (module) return true;
        }
        return false;
    }

    private static boolean isSkipped(Path file, List<Path> skips) {
        for (Path s : skips) {
            if (file.startsWith(s)) return true;
        }
        return false;
    }

    private static List<Path> normalizeAll(List<Path> paths) {
        List<Path> out = new ArrayList<>();
        if (paths == null) return out;
        for (Path p : paths) {
            if (p == null) continue;
            out.add(p.toAbsolutePath().normalize());
        }
        return out;
    }

    public static String normalizeRel(Path root, Path p) {
        return normalizePathString(root.toAbsolutePath().normalize().relativize(p.toAbsolutePath().normalize()));
    }

    private static String normalizePathString(Path p) {
        return p.toString().replace("\\", "/");
    }
}
