package info.isaksson.erland.errnumgen;

import info.isaksson.erland.errnumgen.core.ErrNumGenOptions;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MainCliArgsTest {

    @Test
    void defaults() {
        Main.CliArgs a = Main.CliArgs.parse(new String[0]);
        assertEquals(".", a.source);
        assertEquals("errnums", a.outPkg);
        assertNull(a.outFile);
        assertTrue(a.skips.isEmpty());
        assertFalse(a.dry);
        assertTrue(a.bkp);
        assertNull(a.report);
    }

    @Test
    void parsesAllFlags() {
        Main.CliArgs a = Main.CliArgs.parse(new String[] {
                "--out-pkg", "codes",
                "--out-file=gen/codes.go",
                "--skip", "a,b",
                "--skip", "c",
                "--dry",
                "--bkp", "no",
                "--report", "out/report.json",
                "src"
        });
        assertEquals("src", a.source);
        assertEquals("codes", a.outPkg);
        assertEquals("gen/codes.go", a.outFile);
        assertEquals(List.of("a", "b", "c"), a.skips);
        assertTrue(a.dry);
        assertFalse(a.bkp);
        assertEquals("out/report.json", a.report);
    }

    @Test
    void emptySkipEntriesAreIgnored() {
        Main.CliArgs a = Main.CliArgs.parse(new String[] {"--skip", "a,, b ,"});
        assertEquals(List.of("a", "b"), a.skips);
    }

    @Test
    void rejectsBadInput() {
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--nope"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--out-pkg"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--bkp", "maybe"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"a", "b"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--report", "--dry"}));
    }

    @Test
    void flagsAreEchoedInNameOrder() {
        Main.CliArgs a = Main.CliArgs.parse(new String[] {"--skip", "x", "--dry"});
        assertEquals("bkp=\"true\" dry=\"true\" out-file=\"\" out-pkg=\"errnums\" report=\"\" skip=\"x\" source=\".\"",
                a.describe());
    }

    @Test
    void skipPathsAreMadeAbsolute() {
        ErrNumGenOptions o = Main.toCoreOptions(Main.CliArgs.parse(new String[] {"--skip", "gen", "--out-file", "x/y.go"}));
        assertEquals(List.of(Path.of("gen").toAbsolutePath().normalize()), o.skipPaths);
        assertEquals(Path.of("x/y.go").toAbsolutePath().normalize(), o.outputFile);
        assertTrue(o.backup);
        assertFalse(o.dryRun);
    }

    @Test
    void helpAndUsageExitCodes() {
        assertEquals(0, Main.run(new String[] {"--help"}));
        assertEquals(1, Main.run(new String[] {"--unknown"}));
        assertEquals(1, Main.run(new String[] {"--out-pkg", "not-valid", "."}));
    }
}
