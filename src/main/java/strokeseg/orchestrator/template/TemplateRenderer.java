package strokeseg.orchestrator.template;

import strokeseg.orchestrator.exception.MissingVariableException;
import strokeseg.orchestrator.exception.TemplateNotFoundException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders job scripts from named templates with {@code {{variable}}} placeholders.
 * <p>
 * Substitution is a single pass over the template text: values are copied verbatim
 * and never scanned for placeholders, so a value containing {@code {{x}}} stays literal.
 */
public class TemplateRenderer {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([A-Za-z0-9_]+)\\s*}}");

    private final TemplateSource source;

    public TemplateRenderer(TemplateSource source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    /**
     * Render a template.
     *
     * @throws TemplateNotFoundException if no template has that name
     * @throws MissingVariableException  listing every placeholder absent from {@code variables}
     */
    public String render(String templateName, Map<String, String> variables) {
        String template = loadTemplate(templateName);

        List<String> missing = missingIn(template, variables);
        if (!missing.isEmpty()) {
            throw new MissingVariableException(templateName, missing);
        }

        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder(template.length() + 256);
        while (m.find()) {
            m.appendReplacement(out, Matcher.quoteReplacement(variables.get(m.group(1))));
        }
        m.appendTail(out);
        return out.toString();
    }

    /**
     * Placeholder names a template references, in order of first appearance.
     */
    public Set<String> requiredVariables(String templateName) {
        return placeholders(loadTemplate(templateName));
    }

    /**
     * Names {@link #render} would reject, without rendering.
     */
    public List<String> missingVariables(String templateName, Map<String, String> variables) {
        return missingIn(loadTemplate(templateName), variables);
    }

    private String loadTemplate(String templateName) {
        return source.load(templateName)
                .orElseThrow(() -> new TemplateNotFoundException(templateName));
    }

    private static List<String> missingIn(String template, Map<String, String> variables) {
        List<String> missing = new ArrayList<>();
        for (String name : placeholders(template)) {
            if (variables == null || variables.get(name) == null) {
                missing.add(name);
            }
        }
        return missing;
    }

    private static Set<String> placeholders(String template) {
        Set<String> names = new LinkedHashSet<>();
        Matcher m = PLACEHOLDER.matcher(template);
        while (m.find()) {
            names.add(m.group(1));
        }
        return names;
    }
}
