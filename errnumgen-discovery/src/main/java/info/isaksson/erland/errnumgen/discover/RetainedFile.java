package info.isaksson.erland.errnumgen.discover;

import info.isaksson.erland.errnumgen.load.SourceFile;
import org.treesitter.TSNode;

import java.util.List;

/** A source file together with the declarations kept for error-return discovery. */
public final class RetainedFile {
    public final SourceFile file;
    public final List<TSNode> decls;

    public RetainedFile(SourceFile file, List<TSNode> decls) {
        this.file = file;
        this.decls = List.copyOf(decls);
    }
}
