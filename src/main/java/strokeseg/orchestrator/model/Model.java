package strokeseg.orchestrator.model;

import java.time.Instant;

/**
 * A trained model. Created once, when its training job completes.
 */
public record Model(
        String id,
        String trainingId,
        String modelName,
        String modelPath,
        Instant createdAt) {
}
