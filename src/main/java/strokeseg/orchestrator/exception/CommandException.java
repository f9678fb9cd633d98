package strokeseg.orchestrator.exception;

/**
 * An external command could not be started or did not finish in time.
 */
public class CommandException extends OrchestratorException {

    private final boolean timedOut;

    public CommandException(String message, Throwable cause, boolean timedOut) {
        super(message, cause);
        this.timedOut = timedOut;
    }

    public boolean timedOut() {
        return timedOut;
    }
}
