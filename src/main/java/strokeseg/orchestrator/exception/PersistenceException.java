package strokeseg.orchestrator.exception;

/**
 * A database operation failed.
 */
public class PersistenceException extends OrchestratorException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
