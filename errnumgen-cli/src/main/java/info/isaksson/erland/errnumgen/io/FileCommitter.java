package info.isaksson.erland.errnumgen.io;

import info.isaksson.erland.errnumgen.core.ErrNumGenResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Writes the result of a run to disk.
 *
 * <p>The registry file goes first, then every rewritten source in place. Sources keep their permissions;
 * backups get the same permissions as their source.</p>
 */
public final class FileCommitter {

    public static final String BACKUP_SUFFIX = ".bkp";

    private FileCommitter() {}

    /**
     * @return every path written, backups included, in write order
     */
    public static List<Path> commit(ErrNumGenResult result, boolean backup) throws IOException {
        if (result == null) throw new IllegalArgumentException("result must not be null");
        List<Path> written = new ArrayList<>();

        Path out = result.outputPath;
        try {
            Path parent = out.getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.write(out, result.outputBytes());
        } catch (IOException e) {
            throw new IOException("failed to write the output file " + out + ": " + e.getMessage(), e);
        }
        written.add(out);

        for (Map.Entry<Path, byte[]> e : result.updatedSources.entrySet()) {
            Path source = e.getKey();
            Set<PosixFilePermission> perms = permissions(source);
            if (backup) {
                Path bkp = backupPath(source);
                try {
                    Files.write(bkp, Files.readAllBytes(source));
                    if (perms != null) Files.setPosixFilePermissions(bkp, perms);
                } catch (IOException ex) {
                    throw new IOException("failed to write source file backup " + bkp + ": " + ex.getMessage(), ex);
                }
                written.add(bkp);
            }
            try {
                Files.write(source, e.getValue());
            } catch (IOException ex) {
                throw new IOException("failed to write source file " + source + ": " + ex.getMessage(), ex);
            }
            written.add(source);
        }
        return written;
    }

    public static Path backupPath(Path source) {
        return source.resolveSibling(source.getFileName().toString() + BACKUP_SUFFIX);
    }

    /** POSIX permissions of a file, or null where the file system has none. */
    private static Set<PosixFilePermission> permissions(Path file) throws IOException {
        if (Files.getFileAttributeView(file, PosixFileAttributeView.class) == null) return null;
        try {
            return Files.getPosixFilePermissions(file);
        } catch (IOException e) {
            throw new IOException("failed to stat the source file " + file + ": " + e.getMessage(), e);
        }
    }
}
