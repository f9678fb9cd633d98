package strokeseg.orchestrator.scheduler;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * One observation of a job as the scheduler reports it.
 *
 * @param externalId scheduler job id
 * @param rawState   state string as reported, null if absent
 * @param startTime  when the job started, if known
 * @param endTime    when the job ended, if known
 * @param exitCode   SLURM style "code:signal", if known
 * @param reason     scheduler reason text, if any
 */
public record SchedulerJobInfo(
        String externalId,
        String rawState,
        Instant startTime,
        Instant endTime,
        String exitCode,
        String reason) {

    private static final String SUCCESS_EXIT = "0:0";
    private static final Set<String> EMPTY_REASONS = Set.of("None", "(null)", "N/A");

    /** Observation for a job the scheduler no longer lists. */
    public static SchedulerJobInfo notFound(String externalId) {
        return new SchedulerJobInfo(externalId, StateMapping.NOT_FOUND, null, null, null,
                "Job completed and removed from scheduler queue");
    }

    /** Observation carrying only a state. */
    public static SchedulerJobInfo ofState(String externalId, String rawState) {
        return new SchedulerJobInfo(externalId, rawState, null, null, null, null);
    }

    /**
     * Human readable failure description, e.g.
     * "Job state: TIMEOUT; Exit code: 0:15; Reason: TimeLimit; Job exceeded time limit".
     */
    public String failureDescription() {
        String state = rawState == null ? null : rawState.trim().split("\\s+")[0].toUpperCase(Locale.ROOT);
        List<String> parts = new ArrayList<>();

        if (state != null && !state.isEmpty()) {
            parts.add("Job state: " + state);
        }
        boolean badExit = exitCode != null && !exitCode.isBlank() && !SUCCESS_EXIT.equals(exitCode);
        if (badExit) {
            parts.add("Exit code: " + exitCode);
        }
        if (reason != null && !reason.isBlank() && !EMPTY_REASONS.contains(reason)) {
            parts.add("Reason: " + reason);
        }

        if (state != null) {
            switch (state) {
                case "CANCELLED" -> parts.add("Job was cancelled");
                case "TIMEOUT" -> parts.add("Job exceeded time limit");
                case "OUT_OF_MEMORY" -> parts.add("Job ran out of memory");
                case "NODE_FAIL" -> parts.add("Node failure occurred");
                case "FAILED" -> parts.add(badExit ? "Job failed with non-zero exit code" : "Job failed");
                default -> {
                }
            }
        }

        return parts.isEmpty() ? "Job failed with state: " + rawState : String.join("; ", parts);
    }
}
