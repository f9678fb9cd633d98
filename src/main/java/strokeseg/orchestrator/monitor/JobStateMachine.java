package strokeseg.orchestrator.monitor;

import strokeseg.orchestrator.exception.ReconciliationExhaustedException;
import strokeseg.orchestrator.model.JobStatus;
import strokeseg.orchestrator.monitor.Reconciliation.Outcome;
import strokeseg.orchestrator.monitor.Reconciliation.TerminalEffect;
import strokeseg.orchestrator.scheduler.StateMapping;

import java.util.Objects;
import java.util.Optional;

/**
 * Maps raw scheduler states onto the PENDING -> RUNNING -> {COMPLETED | FAILED} chain.
 * <p>
 * Pure: the result depends only on the arguments and the mapping/threshold given at construction.
 */
public final class JobStateMachine {

    private final StateMapping mapping;
    private final int unknownThreshold;

    public JobStateMachine(StateMapping mapping, int unknownThreshold) {
        if (unknownThreshold < 1) {
            throw new IllegalArgumentException("unknownThreshold must be at least 1");
        }
        this.mapping = Objects.requireNonNull(mapping, "mapping");
        this.unknownThreshold = unknownThreshold;
    }

    /**
     * @param current             persisted status
     * @param unknownObservations persisted consecutive unknown count
     * @param rawState            state reported by the scheduler, null if none
     */
    public Reconciliation reconcile(JobStatus current, int unknownObservations, String rawState) {
        if (current.isTerminal()) {
            return noop(current, unknownObservations);
        }

        Optional<JobStatus> mapped = mapping.map(rawState);
        if (mapped.isEmpty()) {
            return unknown(current, unknownObservations, rawState == null || rawState.isBlank() ? "<none>" : rawState);
        }

        JobStatus next = mapped.get();
        if (!current.canTransitionTo(next)) {
            // same status, or a requeue reported as PENDING after RUNNING
            return new Reconciliation(Outcome.UNCHANGED, current, 0, null, null);
        }

        if (next == JobStatus.RUNNING) {
            return new Reconciliation(Outcome.ADVANCE, next, 0, null, null);
        }
        TerminalEffect effect = next == JobStatus.COMPLETED ? TerminalEffect.ON_COMPLETED : TerminalEffect.ON_FAILED;
        return new Reconciliation(Outcome.TERMINAL, next, 0, effect, null);
    }

    /**
     * An observation that carried no usable state, e.g. a query that timed out.
     *
     * @param lastSeen description of what was observed, used in the exhaustion message
     */
    public Reconciliation unknown(JobStatus current, int unknownObservations, String lastSeen) {
        if (current.isTerminal()) {
            return noop(current, unknownObservations);
        }

        int count = unknownObservations + 1;
        if (count >= unknownThreshold) {
            return new Reconciliation(Outcome.EXHAUSTED, JobStatus.FAILED, count, TerminalEffect.ON_FAILED,
                    new ReconciliationExhaustedException(count, lastSeen));
        }
        return new Reconciliation(Outcome.UNKNOWN, current, count, null, null);
    }

    public StateMapping mapping() {
        return mapping;
    }

    public int unknownThreshold() {
        return unknownThreshold;
    }

    private static Reconciliation noop(JobStatus current, int unknownObservations) {
        return new Reconciliation(Outcome.NOOP, current, unknownObservations, null, null);
    }
}
