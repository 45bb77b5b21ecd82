package info.isaksson.erland.errnumgen.discover;

import info.isaksson.erland.errnumgen.golang.GoNodeTypes;
import info.isaksson.erland.errnumgen.golang.GoNodes;
import info.isaksson.erland.errnumgen.load.SourceFile;
import org.junit.jupiter.api.Test;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DeclarationFilterTest {

    private static List<String> retainedNames(List<RetainedFile> files) {
        List<String> out = new ArrayList<>();
        for (RetainedFile rf : files) {
            for (TSNode d : rf.decls) out.add(rf.file.source(GoNodes.field(d, GoNodeTypes.FIELD_NAME)));
        }
        return out;
    }

    @Test
    void keepsOnlyFunctionsReturningTheBuiltinErrorType() {
        SourceFile f = GoSources.file("a.go", "package p\n"
                + "import \"errors\"\n"
                + "var ErrX = errors.New(\"x\")\n"
                + "type T struct{}\n"
                + "func plain() {}\n"
                + "func takesError(err error) string { return err.Error() }\n"
                + "func one() error { return nil }\n"
                + "func two() (int, error) { return 0, nil }\n"
                + "func named() (n int, err error) { return }\n"
                + "func custom() *MyError { return nil }\n"
                + "func qualified() pkg.error { return nil }\n"
                + "func (t T) Method() (T, error) { return t, nil }\n"
                + "func stub() error\n");

        List<RetainedFile> retained = DeclarationFilter.filter(GoSources.unit(f));
        assertEquals(List.of("one", "two", "named", "Method"), retainedNames(retained));
    }

    @Test
    void filesWithoutRetainedDeclarationsAreExcluded() {
        SourceFile a = GoSources.file("a.go", "package p\nfunc a() int { return 1 }\n");
        SourceFile b = GoSources.file("b.go", "package p\nfunc b() error { return nil }\n");

        List<RetainedFile> retained = DeclarationFilter.filter(GoSources.unit(a, b));
        assertEquals(1, retained.size());
        assertSame(b, retained.get(0).file);
    }

    @Test
    void errorSlotCountsEveryGroupedName() {
        SourceFile f = GoSources.file("a.go", "package p\n"
                + "func a() (x, y, z int, err error) { return }\n"
                + "func b() (error, int) { return nil, 0 }\n"
                + "func c() (s string, err1, err2 error) { return }\n"
                + "func d() int { return 0 }\n");
        List<Integer> slots = new ArrayList<>();
        List<Integer> counts = new ArrayList<>();
        for (TSNode d : f.declarations()) {
            slots.add(DeclarationFilter.errorResultIndex(f, d));
            counts.add(DeclarationFilter.resultCount(d));
        }
        assertEquals(List.of(3, 0, 1, -1), slots);
        assertEquals(List.of(4, 2, 3, 1), counts);
    }

    @Test
    void literalResultsAreReadTheSameWay() {
        SourceFile f = GoSources.file("a.go", "package p\n"
                + "func f() error {\n"
                + "\tg := func() (n int, err error) { return }\n"
                + "\th := func() int { return 0 }\n"
                + "\t_, _ = g, h\n"
                + "\treturn nil\n}\n");
        List<TSNode> literals = new ArrayList<>();
        GoNodes.walk(f.syntax.root(), n -> {
            if (GoNodes.is(n, GoNodeTypes.FUNC_LITERAL)) literals.add(n);
            return true;
        });
        assertEquals(2, literals.size());
        assertEquals(1, DeclarationFilter.errorResultIndex(f, literals.get(0)));
        assertEquals(-1, DeclarationFilter.errorResultIndex(f, literals.get(1)));
    }
}
