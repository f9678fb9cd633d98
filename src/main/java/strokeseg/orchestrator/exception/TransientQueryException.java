package strokeseg.orchestrator.exception;

/**
 * A status query could not be answered this cycle. The job keeps its status and is retried.
 */
public class TransientQueryException extends OrchestratorException {

    private final boolean timedOut;

    public TransientQueryException(String message, Throwable cause, boolean timedOut) {
        super(message, cause);
        this.timedOut = timedOut;
    }

    public TransientQueryException(String message, Throwable cause) {
        this(message, cause, false);
    }

    /** Timed-out queries count as an unknown observation. */
    public boolean timedOut() {
        return timedOut;
    }
}
