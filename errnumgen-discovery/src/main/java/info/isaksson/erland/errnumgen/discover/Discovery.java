package info.isaksson.erland.errnumgen.discover;

import info.isaksson.erland.errnumgen.load.SourceFile;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Error expressions found in one run, each list in traversal order. */
public final class Discovery {
    public final List<ErrorExpression> scheduled;
    public final List<ErrorExpression> alreadyWrapped;
    public final List<ErrorExpression> skipped;

    public Discovery(List<ErrorExpression> scheduled, List<ErrorExpression> alreadyWrapped, List<ErrorExpression> skipped) {
        this.scheduled = List.copyOf(scheduled);
        this.alreadyWrapped = List.copyOf(alreadyWrapped);
        this.skipped = List.copyOf(skipped);
    }

    /** Scheduled expressions grouped per file, files in traversal order. */
    public Map<SourceFile, List<ErrorExpression>> scheduledByFile() {
        Map<SourceFile, List<ErrorExpression>> out = new LinkedHashMap<>();
        for (ErrorExpression e : scheduled) {
            out.computeIfAbsent(e.file, f -> new ArrayList<>()).add(e);
        }
        return out;
    }
}
