package strokeseg.orchestrator.model;

import java.time.Instant;

/**
 * A user-initiated training request and the job that fulfils it.
 */
public record Training(
        String id,
        String name,
        String imagesPath,
        String labelsPath,
        String modelPath,
        String configuration,
        int foldIndex,
        String jobId,
        TrainingStatus status,
        String errorMessage,
        Instant startTime,
        Instant endTime,
        Instant createdAt) {

    /** Deterministic name of the model this training produces. */
    public String modelName() {
        return name + "_model";
    }
}
