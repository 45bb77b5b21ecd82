package info.isaksson.erland.errnumgen.rewrite;

import info.isaksson.erland.errnumgen.discover.DeclarationFilter;
import info.isaksson.erland.errnumgen.discover.Discovery;
import info.isaksson.erland.errnumgen.discover.DiscoveryWarnings;
import info.isaksson.erland.errnumgen.discover.EditClassifier;
import info.isaksson.erland.errnumgen.discover.ErrorExpression;
import info.isaksson.erland.errnumgen.discover.ErrorNodeFinder;
import info.isaksson.erland.errnumgen.golang.GoParser;
import info.isaksson.erland.errnumgen.load.CompilationUnit;
import info.isaksson.erland.errnumgen.load.SourceFile;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class EditSynthesizerTest {

    private static final GoParser PARSER = new GoParser();

    static SourceFile file(String src) {
        byte[] bytes = src.getBytes(StandardCharsets.UTF_8);
        return new SourceFile(Path.of("a.go").toAbsolutePath(), "a.go", bytes, PARSER.parseFile(src), true);
    }

    static List<ErrorExpression> scheduled(SourceFile f) {
        CompilationUnit unit = new CompilationUnit(Path.of(".").toAbsolutePath(), ".", f.packageName(), List.of(f));
        Discovery d = new ErrorNodeFinder(EditClassifier.scheduleAll(), new DiscoveryWarnings())
                .find(DeclarationFilter.filter(unit));
        return d.scheduled;
    }

    @Test
    void wrapsTheOriginalExpression() {
        SourceFile f = file("package p\nfunc f() (string, error) { return \"\", errors.New(\"bad\") }\n");
        ErrorExpression e = scheduled(f).get(0);

        Edit edit = new EditSynthesizer("errnums").synthesize(e, 1);
        assertEquals(e.start(), edit.start);
        assertEquals(e.end(), edit.end);
        assertEquals("errnums.New(errnums.N_1, errors.New(\"bad\"))", edit.replacementText());
    }

    @Test
    void copiesMultiLineAndNonAsciiTextVerbatim() {
        String original = "fmt.Errorf(\"größe %d\",\n\t\tn, // keep\n\t)";
        SourceFile f = file("package p\nfunc f(n int) error {\n\treturn " + original + "\n}\n");
        Edit edit = new EditSynthesizer("codes").synthesize(scheduled(f).get(0), 42);

        assertEquals("codes.New(codes.N_42, " + original + ")", edit.replacementText());
        byte[] out = FileEditApplier.apply(f.content(), List.of(edit));
        String rewritten = new String(out, StandardCharsets.UTF_8);
        assertEquals("package p\nfunc f(n int) error {\n\treturn codes.New(codes.N_42, " + original + ")\n}\n", rewritten);
    }

    @Test
    void replacementThatDoesNotParseIsFatal() {
        SourceFile f = file("package p\nfunc f() error { return err }\n");
        MalformedRewriteException ex = assertThrows(MalformedRewriteException.class,
                () -> new EditSynthesizer("bad pkg").synthesize(scheduled(f).get(0), 1));
        assertTrue(ex.getMessage().startsWith("a.go:2:25: "), ex.getMessage());
        assertEquals("bad pkg.New(bad pkg.N_1, err)", ex.replacement);
    }

    @Test
    void wrapsFunctionLiteralCallsWhole() {
        String original = "func() error {\n\t\treturn errors.New(\"x\")\n\t}()";
        SourceFile f = file("package p\nfunc f() error {\n\treturn " + original + "\n}\n");
        List<ErrorExpression> found = scheduled(f);
        assertEquals(1, found.size());
        Edit edit = new EditSynthesizer("errnums").synthesize(found.get(0), 1);
        assertEquals("errnums.New(errnums.N_1, " + original + ")", edit.replacementText());
    }
}
