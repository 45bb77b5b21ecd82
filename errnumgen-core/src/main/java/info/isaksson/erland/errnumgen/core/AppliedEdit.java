package info.isaksson.erland.errnumgen.core;

import info.isaksson.erland.errnumgen.discover.ErrorExpression;
import info.isaksson.erland.errnumgen.rewrite.Edit;

import java.nio.file.Path;

/** An error expression that was wrapped, with its new error number. */
public final class AppliedEdit {
    public final Path path;
    public final String file;
    public final int line;
    public final int column;
    public final int id;

    /** Byte range in the original file. */
    public final int start;
    public final int end;

    public final String original;
    public final String replacement;

    AppliedEdit(ErrorExpression expr, Edit edit, int id) {
        this.path = expr.file.path;
        this.file = expr.file.relativePath;
        this.line = expr.line();
        this.column = expr.file.column(expr.start());
        this.id = id;
        this.start = edit.start;
        this.end = edit.end;
        this.original = expr.text();
        this.replacement = edit.replacementText();
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column + " N_" + id + " " + original;
    }
}
