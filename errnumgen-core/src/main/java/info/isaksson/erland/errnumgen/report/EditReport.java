package info.isaksson.erland.errnumgen.report;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.errnumgen.core.AppliedEdit;
import info.isaksson.erland.errnumgen.core.ErrNumGenResult;
import info.isaksson.erland.errnumgen.discover.DiscoveryWarning;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/** Machine-readable summary of a run. */
@JsonPropertyOrder({"outputFile", "outputPackage", "recoveredMax", "counter", "alreadyWrapped", "edits", "warnings"})
public final class EditReport {
    public final String outputFile;
    public final String outputPackage;
    public final int recoveredMax;
    public final int counter;
    public final int alreadyWrapped;
    public final List<Entry> edits;
    public final List<Warning> warnings;

    @JsonCreator
    public EditReport(
            @JsonProperty("outputFile") String outputFile,
            @JsonProperty("outputPackage") String outputPackage,
            @JsonProperty("recoveredMax") int recoveredMax,
            @JsonProperty("counter") int counter,
            @JsonProperty("alreadyWrapped") int alreadyWrapped,
            @JsonProperty("edits") List<Entry> edits,
            @JsonProperty("warnings") List<Warning> warnings
    ) {
        this.outputFile = outputFile;
        this.outputPackage = outputPackage;
        this.recoveredMax = recoveredMax;
        this.counter = counter;
        this.alreadyWrapped = alreadyWrapped;
        this.edits = edits == null ? List.of() : List.copyOf(edits);
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /** Builds the report of a run; {@code outputFile} is the registry path as the caller wants it shown. */
    public static EditReport from(ErrNumGenResult result, String outputFile) {
        List<Entry> edits = new ArrayList<>();
        for (AppliedEdit e : result.edits) {
            edits.add(new Entry(e.id, e.file, e.line, e.column, e.original, e.replacement));
        }
        edits.sort(Comparator.comparingInt((Entry e) -> e.id));
        List<Warning> warnings = new ArrayList<>();
        for (DiscoveryWarning w : result.warnings) {
            warnings.add(new Warning(w.code, w.message, w.context));
        }
        return new EditReport(outputFile, result.outputPackage, result.recoveredMax, result.counter,
                result.alreadyWrapped, edits, warnings);
    }

    @JsonPropertyOrder({"id", "file", "line", "column", "original", "replacement"})
    public static final class Entry {
        public final int id;
        public final String file;
        public final int line;
        public final int column;
        public final String original;
        public final String replacement;

        @JsonCreator
        public Entry(
                @JsonProperty("id") int id,
                @JsonProperty("file") String file,
                @JsonProperty("line") int line,
                @JsonProperty("column") int column,
                @JsonProperty("original") String original,
                @JsonProperty("replacement") String replacement
        ) {
            this.id = id;
            this.file = file;
            this.line = line;
            this.column = column;
            this.original = original;
            this.replacement = replacement;
        }
    }

    @JsonPropertyOrder({"code", "message", "context"})
    public static final class Warning {
        public final String code;
        public final String message;

        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        public final Map<String, String> context;

        @JsonCreator
        public Warning(
                @JsonProperty("code") String code,
                @JsonProperty("message") String message,
                @JsonProperty("context") Map<String, String> context
        ) {
            this.code = code;
            this.message = message;
            this.context = context == null ? Map.of() : Map.copyOf(context);
        }
    }
}
