package strokeseg.orchestrator.model;

import java.time.Instant;

/**
 * An evaluation of a trained model on a labelled dataset.
 * {@code configurations} and {@code results} are JSON documents.
 */
public record Evaluation(
        String id,
        String modelId,
        String jobId,
        String evaluationPath,
        String outputPath,
        String configurations,
        EvaluationStatus status,
        String results,
        String errorMessage,
        Instant startTime,
        Instant endTime,
        Instant createdAt) {
}
