package strokeseg.orchestrator.model;

import java.time.Instant;

/**
 * An inference request against a trained model.
 * {@code prediction} holds the JSON result payload once the job completes.
 */
public record Inference(
        String id,
        String modelId,
        String jobId,
        String inputPath,
        String outputDir,
        String prediction,
        InferenceStatus status,
        String errorMessage,
        Instant startTime,
        Instant endTime,
        Instant createdAt) {
}
