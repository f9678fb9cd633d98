package strokeseg.orchestrator.exception;

/**
 * No template is registered under the requested name.
 */
public class TemplateNotFoundException extends OrchestratorException {

    private final String templateName;

    public TemplateNotFoundException(String templateName) {
        super("Template not found: " + templateName);
        this.templateName = templateName;
    }

    public TemplateNotFoundException(String templateName, Throwable cause) {
        super("Template not found: " + templateName, cause);
        this.templateName = templateName;
    }

    public String templateName() {
        return templateName;
    }
}
