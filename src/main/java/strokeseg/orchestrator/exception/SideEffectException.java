package strokeseg.orchestrator.exception;

/**
 * A terminal side effect could not be applied. The job status write is rolled back with it.
 */
public class SideEffectException extends OrchestratorException {

    public SideEffectException(String message) {
        super(message);
    }

    public SideEffectException(String message, Throwable cause) {
        super(message, cause);
    }
}
