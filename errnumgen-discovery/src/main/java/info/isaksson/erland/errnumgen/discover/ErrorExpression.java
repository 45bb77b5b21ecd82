package info.isaksson.erland.errnumgen.discover;

import info.isaksson.erland.errnumgen.load.SourceFile;
import org.treesitter.TSNode;

/** The expression in the error slot of a return statement, with offsets into the original file bytes. */
public final class ErrorExpression {
    public final SourceFile file;
    public final TSNode expr;
    public final Classification classification;

    public ErrorExpression(SourceFile file, TSNode expr, Classification classification) {
        this.file = file;
        this.expr = expr;
        this.classification = classification;
    }

    public int start() {
        return expr.getStartByte();
    }

    public int end() {
        return expr.getEndByte();
    }

    public int line() {
        return file.line(start());
    }

    /** Original source text, for display. */
    public String text() {
        return file.source(expr);
    }

    @Override
    public String toString() {
        return file.position(start()) + " " + text();
    }
}
