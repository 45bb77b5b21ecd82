package info.isaksson.erland.errnumgen.report;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON serialization of {@link EditReport}.
 *
 * <p>Output is deterministic: fixed property order, key-sorted maps and a trailing newline.</p>
 */
public final class EditReportJson {

    private static final ObjectMapper MAPPER = createMapper();
    private static final DefaultPrettyPrinter PRETTY = createPrettyPrinter();

    private EditReportJson() {}

    public static EditReport read(Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        try (var in = Files.newInputStream(path)) {
            return MAPPER.readValue(in, EditReport.class);
        }
    }

    public static EditReport readFromString(String json) throws IOException {
        if (json == null) throw new IllegalArgumentException("json is null");
        return MAPPER.readValue(json, EditReport.class);
    }

    public static void write(EditReport report, Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        Path parent = path.toAbsolutePath().normalize().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (var out = Files.newOutputStream(path)) {
            MAPPER.writer(PRETTY).writeValue(out, report);
            out.write('\n');
        }
    }

    public static String toJsonString(EditReport report) throws IOException {
        return MAPPER.writer(PRETTY).writeValueAsString(report) + "\n";
    }

    private static ObjectMapper createMapper() {
        ObjectMapper om = new ObjectMapper();
        om.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        // Leave the caller's stream open.
        om.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        return om;
    }

    private static DefaultPrettyPrinter createPrettyPrinter() {
        DefaultPrettyPrinter pp = new DefaultPrettyPrinter();
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        pp.indentObjectsWith(indenter);
        pp.indentArraysWith(indenter);
        return pp;
    }
}
