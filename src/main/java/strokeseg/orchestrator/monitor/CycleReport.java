package strokeseg.orchestrator.monitor;

import strokeseg.orchestrator.model.JobType;

/**
 * Counts from one poll cycle of one monitor.
 */
public record CycleReport(JobType jobType, int polled, int transitioned, int unchanged, int errors) {

    public static CycleReport empty(JobType jobType) {
        return new CycleReport(jobType, 0, 0, 0, 0);
    }
}
