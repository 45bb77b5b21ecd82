package info.isaksson.erland.errnumgen;

import info.isaksson.erland.errnumgen.core.ErrNumGenOptions;
import info.isaksson.erland.errnumgen.core.ErrNumGenResult;
import info.isaksson.erland.errnumgen.core.ErrNumGenService;
import info.isaksson.erland.errnumgen.discover.DiscoveryWarning;
import info.isaksson.erland.errnumgen.io.FileCommitter;
import info.isaksson.erland.errnumgen.report.EditReport;
import info.isaksson.erland.errnumgen.report.EditReportJson;
import info.isaksson.erland.errnumgen.rewrite.EditSynthesizer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * CLI entrypoint: wraps the error returns of a Go source tree and writes the registry file.
 */
public final class Main {

    private static final ErrNumGenService SERVICE = new ErrNumGenService();

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Testable entrypoint that returns an exit code instead of calling System.exit.
     */
    public static int run(String[] args) {
        CliArgs parsed;
        try {
            parsed = CliArgs.parse(args);
        } catch (IllegalArgumentException ex) {
            System.err.println("Error: " + ex.getMessage());
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        if (parsed.help) {
            CliArgs.printHelp();
            return 0;
        }

        System.err.println("errnumgen: flags: " + parsed.describe());

        final Path sourcePath = Paths.get(parsed.source).toAbsolutePath().normalize();
        if (!Files.exists(sourcePath)) {
            System.err.println("Error: source does not exist: " + sourcePath);
            return 1;
        }
        if (!Files.isDirectory(sourcePath)) {
            System.err.println("Error: source must be a directory: " + sourcePath);
            return 1;
        }

        final ErrNumGenOptions options;
        try {
            options = toCoreOptions(parsed);
            options.validate();
        } catch (IllegalArgumentException ex) {
            System.err.println("Error: " + ex.getMessage());
            return 1;
        }

        final ErrNumGenResult result;
        try {
            result = SERVICE.generate(sourcePath, options);
        } catch (RuntimeException | IOException ex) {
            System.err.println("Error: generation failed.");
            System.err.println(ex.getMessage());
            return 2;
        }

        for (DiscoveryWarning w : result.warnings) {
            System.err.println("warning: " + w.code + ": " + w.message);
        }

        if (parsed.report != null && !parsed.report.isBlank()) {
            Path reportOut = Paths.get(parsed.report).toAbsolutePath().normalize();
            try {
                EditReportJson.write(EditReport.from(result, displayPath(sourcePath, result.outputPath)), reportOut);
            } catch (IOException e) {
                System.err.println("Error: could not write report to: " + reportOut);
                System.err.println(e.getMessage());
                return 2;
            }
        }

        if (options.dryRun) {
            printDryRun(result);
        } else {
            try {
                FileCommitter.commit(result, options.backup);
            } catch (IOException e) {
                System.err.println("Error: could not write results.");
                System.err.println(e.getMessage());
                return 2;
            }
        }

        System.out.println(
                "errnumgen" + (options.dryRun ? " (dry run)" : "") + "\n" +
                "- Source: " + sourcePath + "\n" +
                "- Output file: " + result.outputPath + "\n" +
                "- Packages: " + result.unitCount + ", files: " + result.fileCount + "\n" +
                "- Updated files: " + result.updatedSources.size() + "\n" +
                "- New error numbers: " + result.edits.size() + " (already wrapped: " + result.alreadyWrapped + ")\n" +
                "- Highest error number: " + result.counter + "\n" +
                (parsed.report != null ? "- Report: " + Paths.get(parsed.report).toAbsolutePath().normalize() + "\n" : "") +
                "- Warnings: " + result.warnings.size()
        );
        return 0;
    }

    static ErrNumGenOptions toCoreOptions(CliArgs parsed) {
        ErrNumGenOptions opts = new ErrNumGenOptions();
        opts.outputPackage = parsed.outPkg;
        if (parsed.outFile != null && !parsed.outFile.isBlank()) {
            opts.outputFile = Paths.get(parsed.outFile).toAbsolutePath().normalize();
        }
        for (String s : parsed.skips) {
            opts.skipPaths.add(Paths.get(s).toAbsolutePath().normalize());
        }
        opts.dryRun = parsed.dry;
        opts.backup = parsed.bkp;
        return opts;
    }

    private static void printDryRun(ErrNumGenResult result) {
        System.out.println("=== OUTPUT FILE ===");
        System.out.println(result.outputContent);
        System.out.println();
        System.out.println("=== SOURCE FILES ===");
        for (Map.Entry<Path, byte[]> e : result.updatedSources.entrySet()) {
            System.out.println("---> " + e.getKey());
            System.out.println(new String(e.getValue(), StandardCharsets.UTF_8));
            System.out.println();
        }
    }

    /** Path relative to the source root with '/' separators, or absolute when it lies outside. */
    static String displayPath(Path root, Path p) {
        if (p.startsWith(root)) {
            return root.relativize(p).toString().replace('\\', '/');
        }
        return p.toString();
    }

    static final class CliArgs {
        boolean help = false;
        String source;
        String outPkg = EditSynthesizer.DEFAULT_PACKAGE;
        String outFile;
        final List<String> skips = new ArrayList<>();
        boolean dry = false;
        boolean bkp = true;
        String report;

        static CliArgs parse(String[] args) {
            CliArgs out = new CliArgs();

            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                if (a == null) continue;

                // support --flag=value
                int eq = a.indexOf('=');
                if (a.startsWith("--") && eq > 0) {
                    String flag = a.substring(0, eq);
                    String value = a.substring(eq + 1);
                    out.apply(flag, value);
                    continue;
                }

                switch (a) {
                    case "--help":
                    case "-h":
                        out.help = true;
                        break;
                    case "--dry":
                        out.dry = true;
                        break;
                    case "--source":
                    case "--out-pkg":
                    case "--out-file":
                    case "--skip":
                    case "--bkp":
                    case "--report":
                        out.apply(a, requireValue(args, ++i, a));
                        break;
                    default:
                        if (a.startsWith("-")) {
                            throw new IllegalArgumentException("Unknown argument: " + a);
                        }
                        // allow a bare path as shorthand for --source
                        if (out.source == null) {
                            out.source = a;
                        } else {
                            throw new IllegalArgumentException("Unexpected extra argument: " + a);
                        }
                }
            }

            if (out.source == null) out.source = ".";
            return out;
        }

        private void apply(String flag, String value) {
            switch (flag) {
                case "--source":
                    source = requireNonBlank(value, flag);
                    break;
                case "--out-pkg":
                    outPkg = requireNonBlank(value, flag);
                    break;
                case "--out-file":
                    outFile = requireNonBlank(value, flag);
                    break;
                case "--skip":
                    for (String s : value.split(",")) {
                        if (!s.isBlank()) skips.add(s.trim());
                    }
                    break;
                case "--dry":
                    dry = parseBoolean(value, flag);
                    break;
                case "--bkp":
                    bkp = parseBoolean(value, flag);
                    break;
                case "--report":
                    report = requireNonBlank(value, flag);
                    break;
                default:
                    throw new IllegalArgumentException("Unknown argument: " + flag);
            }
        }

        /** Effective flags, in name order. */
        String describe() {
            return "bkp=\"" + bkp + "\""
                    + " dry=\"" + dry + "\""
                    + " out-file=\"" + (outFile == null ? "" : outFile) + "\""
                    + " out-pkg=\"" + outPkg + "\""
                    + " report=\"" + (report == null ? "" : report) + "\""
                    + " skip=\"" + String.join(",", skips) + "\""
                    + " source=\"" + source + "\"";
        }

        static String requireValue(String[] args, int index, String flag) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            String v = args[index];
            if (v == null || v.isBlank() || v.startsWith("--")) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + v);
            }
            return v;
        }

        static String requireNonBlank(String v, String flag) {
            if (v == null || v.isBlank()) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + v);
            }
            return v;
        }

        static boolean parseBoolean(String v, String flag) {
            if (v == null) throw new IllegalArgumentException("Missing value for " + flag);
            String s = v.trim().toLowerCase();
            if (s.equals("true") || s.equals("1") || s.equals("yes")) return true;
            if (s.equals("false") || s.equals("0") || s.equals("no")) return false;
            throw new IllegalArgumentException("Invalid boolean for " + flag + ": " + v);
        }

        static void printHelp() {
            System.out.println(
                    "errnumgen\n" +
                    "\n" +
                    "Usage:\n" +
                    "  java -jar errnumgen.jar [options] [<dir>]\n" +
                    "\n" +
                    "Wraps every returned error below <dir> as errnums.New(errnums.N_<id>, err) and regenerates\n" +
                    "the registry file declaring the error numbers.\n" +
                    "\n" +
                    "Options:\n" +
                    "  --source <dir>         Root directory of the Go sources (default: .)\n" +
                    "  --out-pkg <name>       Output package (default: errnums)\n" +
                    "  --out-file <path>      Registry file (default: <dir>/<out-pkg>/errnums.go)\n" +
                    "  --skip <paths>         Comma separated files or directories to skip (repeatable)\n" +
                    "  --dry                  Print the changes to stdout and write nothing\n" +
                    "  --bkp <bool>           Back up each source to <file>.bkp before overwriting it.\n" +
                    "                         Default: true. Ignored with --dry.\n" +
                    "  --report <file>        Write a JSON report of all edits\n" +
                    "  -h, --help             Show help\n" +
                    "\n" +
                    "Examples:\n" +
                    "  java -jar target/errnumgen.jar --dry ./myservice\n" +
                    "  java -jar target/errnumgen.jar --out-pkg codes --skip gen,internal/mocks .\n"
            );
        }
    }
}
