package strokeseg.orchestrator.exception;

/**
 * A submission request is missing or carries malformed values.
 * Raised before anything is sent to the scheduler.
 */
public class ValidationException extends OrchestratorException {

    public ValidationException(String message) {
        super(message);
    }
}
