package strokeseg.orchestrator.exception;

import java.util.List;

/**
 * A template references placeholders that were not supplied.
 */
public class MissingVariableException extends ValidationException {

    private final String templateName;
    private final List<String> missing;

    public MissingVariableException(String templateName, List<String> missing) {
        super("Template '" + templateName + "' is missing variables: " + missing);
        this.templateName = templateName;
        this.missing = List.copyOf(missing);
    }

    public String templateName() {
        return templateName;
    }

    /** Every missing variable, in order of first appearance in the template. */
    public List<String> missing() {
        return missing;
    }
}
