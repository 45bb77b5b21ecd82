package info.isaksson.erland.errnumgen.io;

import info.isaksson.erland.errnumgen.core.ErrNumGenResult;
import info.isaksson.erland.errnumgen.core.ErrNumGenService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

public class FileCommitterTest {

    @TempDir
    Path root;

    private static final String SOURCE = "package p\n\nfunc f() error {\n\treturn errF\n}\n";

    @Test
    void writesRegistryThenBackupThenSource() throws Exception {
        Path src = root.resolve("f.go");
        Files.writeString(src, SOURCE, StandardCharsets.UTF_8);
        ErrNumGenResult result = new ErrNumGenService().generate(root, null);

        List<Path> written = FileCommitter.commit(result, true);

        Path real = src.toAbsolutePath().normalize();
        assertEquals(List.of(result.outputPath, FileCommitter.backupPath(real), real), written);
        assertEquals(SOURCE, Files.readString(FileCommitter.backupPath(real), StandardCharsets.UTF_8));
        assertTrue(Files.readString(real, StandardCharsets.UTF_8).contains("return errnums.New(errnums.N_1, errF)"));
        assertEquals(result.outputContent, Files.readString(result.outputPath, StandardCharsets.UTF_8));
    }

    @Test
    void keepsPermissions() throws Exception {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
        Path src = root.resolve("f.go");
        Files.writeString(src, SOURCE, StandardCharsets.UTF_8);
        Set<PosixFilePermission> perms = PosixFilePermissions.fromString("rw-r-----");
        Files.setPosixFilePermissions(src, perms);
        ErrNumGenResult result = new ErrNumGenService().generate(root, null);

        FileCommitter.commit(result, true);

        assertEquals(perms, Files.getPosixFilePermissions(src));
        assertEquals(perms, Files.getPosixFilePermissions(FileCommitter.backupPath(src)));
    }

    @Test
    void noBackupWhenDisabled() throws Exception {
        Path src = root.resolve("f.go");
        Files.writeString(src, SOURCE, StandardCharsets.UTF_8);
        ErrNumGenResult result = new ErrNumGenService().generate(root, null);

        List<Path> written = FileCommitter.commit(result, false);

        assertEquals(2, written.size());
        assertFalse(Files.exists(FileCommitter.backupPath(src)));
    }
}
