package info.isaksson.erland.errnumgen.registry;

import info.isaksson.erland.errnumgen.rewrite.EditSynthesizer;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;

/**
 * Renders the companion Go file declaring the error number constants {@code N_1 .. N_<counter>} together with
 * the {@code New} constructor used by the rewritten code.
 *
 * <p>The file is rendered in full on every run from the {@code registry.go.tmpl} resource. The same package,
 * counter and template always give the same bytes.</p>
 */
public final class RegistryOutputGenerator {

    public static final String DEFAULT_FILE_NAME = "errnums.go";
    static final String TEMPLATE_RESOURCE = "registry.go.tmpl";

    private final String template;
    private final String prefix;

    public RegistryOutputGenerator() {
        this(loadTemplate(TEMPLATE_RESOURCE), EditSynthesizer.DEFAULT_PREFIX);
    }

    public RegistryOutputGenerator(String template, String prefix) {
        this.template = Objects.requireNonNull(template, "template");
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    public String render(String packageName, IdentifierCounter counter) {
        return render(packageName, counter.current());
    }

    /**
     * @throws RegistryTemplateException if the template has an unknown or unterminated placeholder
     */
    public String render(String packageName, int counter) {
        if (counter < 0) {
            throw new IllegalArgumentException("negative counter: " + counter);
        }
        Map<String, String> values = Map.of(
                "package", packageName,
                "constants", constants(counter));

        StringBuilder out = new StringBuilder(template.length() + counter * 16);
        int i = 0;
        while (true) {
            int open = template.indexOf("{{", i);
            if (open < 0) {
                out.append(template, i, template.length());
                return out.toString();
            }
            int close = template.indexOf("}}", open + 2);
            if (close < 0) {
                throw new RegistryTemplateException("unterminated placeholder at offset " + open);
            }
            String name = template.substring(open + 2, close).trim();
            String value = values.get(name);
            if (value == null) {
                throw new RegistryTemplateException("unknown placeholder {{" + name + "}} at offset " + open);
            }
            out.append(template, i, open).append(value);
            i = close + 2;
        }
    }

    /** Constant block aligned the way gofmt aligns it; empty when no number is in use. */
    String constants(int counter) {
        if (counter == 0) return "";
        int width = (prefix + counter).length();
        StringBuilder sb = new StringBuilder();
        sb.append("\nconst (\n");
        for (int n = 1; n <= counter; n++) {
            String name = prefix + n;
            sb.append('\t').append(name);
            for (int pad = name.length(); pad < width; pad++) sb.append(' ');
            sb.append(" = ").append(n).append('\n');
        }
        sb.append(")\n");
        return sb.toString();
    }

    static String loadTemplate(String resource) {
        try (InputStream in = RegistryOutputGenerator.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new RegistryTemplateException("template resource not found: " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RegistryTemplateException("failed to read template " + resource, e);
        }
    }
}
