package info.isaksson.erland.errnumgen.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SourceScannerTest {

    @TempDir
    Path root;

    private void write(String rel) throws Exception {
        Path p = root.resolve(rel);
        Files.createDirectories(p.getParent());
        Files.writeString(p, "package x\n");
    }

    private List<String> scanRel(List<Path> skips) throws Exception {
        List<String> out = new ArrayList<>();
        for (Path p : SourceScanner.scan(root, skips)) {
            out.add(SourceScanner.normalizeRel(root, p));
        }
        return out;
    }

    @Test
    void followsGoPackagePatternRules() throws Exception {
        write("main.go");
        write("main_test.go");
        write("README.md");
        write("pkg/b.go");
        write("pkg/a.go");
        write("pkg/testdata/fixture.go");
        write("vendor/lib/lib.go");
        write(".git/hooks/x.go");
        write("_scratch/y.go");
        write("pkg/.hidden.go");
        write("pkg/_ignored.go");
        write("tools/go.mod");
        write("tools/tool.go");
        write("tools/sub/deep.go");

        assertEquals(List.of("main.go", "pkg/a.go", "pkg/b.go"), scanRel(List.of()));
    }

    @Test
    void rootWithGoModIsNotANestedModule() throws Exception {
        write("go.mod");
        write("a.go");
        assertEquals(List.of("a.go"), scanRel(List.of()));
    }

    @Test
    void skipPathsMatchFilesAndDirectories() throws Exception {
        write("a.go");
        write("errnums/errnums.go");
        write("gen/one.go");
        write("gen/two.go");
        write("general/keep.go");

        List<Path> skips = List.of(root.resolve("errnums/errnums.go"), root.resolve("gen"));
        assertEquals(List.of("a.go", "general/keep.go"), scanRel(skips));
    }

    @Test
    void relativeSkipPathsAreResolvedAgainstWorkingDirectory() throws Exception {
        write("a.go");
        Path relative = Path.of("").toAbsolutePath().relativize(root.resolve("a.go"));
        assertTrue(scanRel(List.of(relative)).isEmpty());
    }
}
