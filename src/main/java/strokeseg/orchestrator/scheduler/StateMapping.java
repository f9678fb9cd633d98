package strokeseg.orchestrator.scheduler;

import strokeseg.orchestrator.model.JobStatus;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable table from raw scheduler states to internal job status.
 * States absent from the table are unknown observations.
 */
public final class StateMapping {

    /** Raw state reported when the scheduler no longer knows the job. */
    public static final String NOT_FOUND = "NOT_FOUND";

    private final Map<String, JobStatus> table;

    private StateMapping(Map<String, JobStatus> table) {
        this.table = Map.copyOf(table);
    }

    public static StateMapping of(Map<String, JobStatus> table) {
        Map<String, JobStatus> normalized = new LinkedHashMap<>();
        table.forEach((state, status) -> normalized.put(normalize(state), status));
        return new StateMapping(normalized);
    }

    /**
     * SLURM job states. Jobs that left the queue are assumed to have finished
     * cleanly, the scheduler keeps failed jobs visible with their failure state.
     */
    public static StateMapping slurmDefaults() {
        Map<String, JobStatus> table = new LinkedHashMap<>();
        table.put("PENDING", JobStatus.PENDING);
        table.put("CONFIGURING", JobStatus.PENDING);
        table.put("REQUEUED", JobStatus.PENDING);
        table.put("RUNNING", JobStatus.RUNNING);
        table.put("COMPLETING", JobStatus.RUNNING);
        table.put("SUSPENDED", JobStatus.RUNNING);
        table.put("COMPLETED", JobStatus.COMPLETED);
        table.put(NOT_FOUND, JobStatus.COMPLETED);
        table.put("FAILED", JobStatus.FAILED);
        table.put("CANCELLED", JobStatus.FAILED);
        table.put("TIMEOUT", JobStatus.FAILED);
        table.put("OUT_OF_MEMORY", JobStatus.FAILED);
        table.put("NODE_FAIL", JobStatus.FAILED);
        table.put("PREEMPTED", JobStatus.FAILED);
        table.put("BOOT_FAIL", JobStatus.FAILED);
        table.put("DEADLINE", JobStatus.FAILED);
        return of(table);
    }

    /** Copy of this mapping with extra or replaced entries. */
    public StateMapping with(Map<String, JobStatus> overrides) {
        Map<String, JobStatus> merged = new LinkedHashMap<>(table);
        overrides.forEach((state, status) -> merged.put(normalize(state), status));
        return new StateMapping(merged);
    }

    public Optional<JobStatus> map(String rawState) {
        if (rawState == null || rawState.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(table.get(normalize(rawState)));
    }

    public boolean isKnown(String rawState) {
        return map(rawState).isPresent();
    }

    public Map<String, JobStatus> asMap() {
        return table;
    }

    // SLURM appends qualifiers such as "CANCELLED by 1000"
    private static String normalize(String rawState) {
        String trimmed = rawState.trim();
        int space = trimmed.indexOf(' ');
        if (space > 0) {
            trimmed = trimmed.substring(0, space);
        }
        return trimmed.toUpperCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "StateMapping" + table;
    }
}
