package strokeseg.orchestrator.template;

import java.util.Optional;

/**
 * Supplies raw template text by name.
 */
public interface TemplateSource {

    /**
     * @param templateName logical template name, e.g. "training"
     * @return template text, or empty if no template carries that name
     */
    Optional<String> load(String templateName);
}
