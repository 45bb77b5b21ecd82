package info.isaksson.erland.errnumgen.core;

import info.isaksson.erland.errnumgen.discover.DeclarationFilter;
import info.isaksson.erland.errnumgen.discover.Discovery;
import info.isaksson.erland.errnumgen.discover.DiscoveryWarnings;
import info.isaksson.erland.errnumgen.discover.ErrorExpression;
import info.isaksson.erland.errnumgen.discover.ErrorNodeFinder;
import info.isaksson.erland.errnumgen.discover.RetainedFile;
import info.isaksson.erland.errnumgen.load.CompilationUnit;
import info.isaksson.erland.errnumgen.load.SourceFile;
import info.isaksson.erland.errnumgen.load.SourceLoader;
import info.isaksson.erland.errnumgen.registry.IdentifierCounter;
import info.isaksson.erland.errnumgen.registry.RegistryClassifier;
import info.isaksson.erland.errnumgen.registry.RegistryOutputGenerator;
import info.isaksson.erland.errnumgen.rewrite.Edit;
import info.isaksson.erland.errnumgen.rewrite.EditSynthesizer;
import info.isaksson.erland.errnumgen.rewrite.FileEditApplier;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Core API: wraps every unwrapped error return below a directory and renders the registry file.
 *
 * <p>The whole run happens in memory. Numbers are handed out only after discovery has seen every file, so
 * they are stable for a given tree and always above the numbers already in use. Callers decide whether and
 * how to write the result.</p>
 */
public final class ErrNumGenService {

    public ErrNumGenResult generate(Path root, ErrNumGenOptions options) throws IOException {
        if (root == null) throw new IllegalArgumentException("root must not be null");
        if (options == null) options = new ErrNumGenOptions();
        options.validate();

        Path sourceRoot = root.toAbsolutePath().normalize();
        Path outputPath = options.resolveOutputFile(sourceRoot);
        String pkg = options.outputPackage;

        List<Path> skips = new ArrayList<>();
        skips.add(outputPath);
        if (options.skipPaths != null) skips.addAll(options.skipPaths);

        List<CompilationUnit> units = new SourceLoader(options.reader).load(sourceRoot, skips);

        List<RetainedFile> retained = new ArrayList<>();
        int fileCount = 0;
        for (CompilationUnit unit : units) {
            fileCount += unit.files.size();
            retained.addAll(DeclarationFilter.filter(unit));
        }

        DiscoveryWarnings warnings = new DiscoveryWarnings();
        IdentifierCounter counter = new IdentifierCounter();
        RegistryClassifier classifier = new RegistryClassifier(pkg, EditSynthesizer.DEFAULT_PREFIX, counter, warnings);
        Discovery discovery = new ErrorNodeFinder(classifier, warnings).find(retained);
        int recoveredMax = counter.recovered();

        EditSynthesizer synthesizer = new EditSynthesizer(pkg);
        Map<Path, byte[]> updated = new LinkedHashMap<>();
        List<AppliedEdit> applied = new ArrayList<>();
        for (Map.Entry<SourceFile, List<ErrorExpression>> e : discovery.scheduledByFile().entrySet()) {
            SourceFile file = e.getKey();
            List<Edit> edits = new ArrayList<>();
            for (ErrorExpression expr : e.getValue()) {
                int id = counter.next();
                Edit edit = synthesizer.synthesize(expr, id);
                edits.add(edit);
                applied.add(new AppliedEdit(expr, edit, id));
            }
            updated.put(file.path, FileEditApplier.apply(file.content(), edits));
        }

        String registry = new RegistryOutputGenerator().render(pkg, counter);

        return new ErrNumGenResult(
                updated,
                outputPath,
                registry,
                pkg,
                applied,
                discovery.alreadyWrapped.size(),
                recoveredMax,
                counter.current(),
                warnings.toDeterministicList(),
                units.size(),
                fileCount
        );
    }
}
