package info.isaksson.erland.errnumgen.discover;

import info.isaksson.erland.errnumgen.load.SourceFile;
import org.treesitter.TSNode;

/**
 * Decides what happens to each error expression found by {@link ErrorNodeFinder}.
 *
 * <p>Discovery only needs the keep/drop answer; knowledge about the wrapping format stays in the
 * implementations.</p>
 */
@FunctionalInterface
public interface EditClassifier {

    Classification classify(SourceFile file, TSNode expr);

    /** Schedules every candidate. */
    static EditClassifier scheduleAll() {
        return (file, expr) -> Classification.schedule();
    }
}
