package strokeseg.orchestrator.monitor;

import strokeseg.orchestrator.exception.ReconciliationExhaustedException;
import strokeseg.orchestrator.model.JobStatus;

/**
 * Result of reconciling one scheduler observation against a job's persisted status.
 *
 * @param outcome             what kind of change, if any, the observation implies
 * @param status              status the job should have afterwards
 * @param unknownObservations consecutive unknown observations afterwards
 * @param effect              side effect to run, only for terminal outcomes
 * @param exhaustion          set only when the job is escalated to FAILED for too many unknown states
 */
public record Reconciliation(
        Outcome outcome,
        JobStatus status,
        int unknownObservations,
        TerminalEffect effect,
        ReconciliationExhaustedException exhaustion) {

    public enum Outcome {
        /** Job already terminal, nothing to write */
        NOOP,
        /** Same status (or a backward one), at most the unknown counter is reset */
        UNCHANGED,
        /** PENDING to RUNNING */
        ADVANCE,
        /** Scheduler reported a terminal state */
        TERMINAL,
        /** State could not be mapped, counter incremented */
        UNKNOWN,
        /** Too many unknown observations, escalated to FAILED */
        EXHAUSTED
    }

    public enum TerminalEffect {
        ON_COMPLETED,
        ON_FAILED
    }

    /** Failure reason decided by the state machine itself, null when the scheduler supplies it. */
    public String errorMessage() {
        return exhaustion == null ? null : exhaustion.getMessage();
    }

    public boolean isTerminal() {
        return outcome == Outcome.TERMINAL || outcome == Outcome.EXHAUSTED;
    }
}
