package strokeseg.orchestrator.exception;

/**
 * The scheduler kept reporting states that could not be mapped.
 * Carried by the reconciliation that escalates the job; its message becomes the job's error message.
 */
public class ReconciliationExhaustedException extends OrchestratorException {

    private final int observations;
    private final String lastRawState;

    public ReconciliationExhaustedException(int observations, String lastRawState) {
        super(describe(observations, lastRawState));
        this.observations = observations;
        this.lastRawState = lastRawState;
    }

    private static String describe(int observations, String lastRawState) {
        return "Reconciliation exhausted: scheduler state could not be interpreted for "
                + observations + " consecutive polls (last state: " + lastRawState + ")";
    }

    public int observations() {
        return observations;
    }

    public String lastRawState() {
        return lastRawState;
    }
}
