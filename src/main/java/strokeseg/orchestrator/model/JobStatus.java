package strokeseg.orchestrator.model;

/**
 * Lifecycle status of a scheduler job.
 * PENDING -> RUNNING -> {COMPLETED | FAILED}, with PENDING -> terminal also allowed.
 */
public enum JobStatus {
    /** Submitted, waiting in the scheduler queue */
    PENDING,
    /** Scheduler reports the job as executing */
    RUNNING,
    /** Finished successfully and its side effect has been applied */
    COMPLETED,
    /** Submission failed, the scheduler reported failure, or reconciliation gave up */
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /** Position in the PENDING -> RUNNING -> terminal chain. */
    int rank() {
        return switch (this) {
            case PENDING -> 0;
            case RUNNING -> 1;
            case COMPLETED, FAILED -> 2;
        };
    }

    /**
     * Whether moving from this status to {@code next} is a forward transition.
     * Staying in the same status is not a transition.
     */
    public boolean canTransitionTo(JobStatus next) {
        if (next == null || next == this || isTerminal()) {
            return false;
        }
        return next.rank() > rank();
    }
}
