package strokeseg.orchestrator.repository;

import strokeseg.orchestrator.model.Inference;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository interface for inference requests.
 */
public interface InferenceRepository {

    void save(Inference inference);

    Optional<Inference> findById(String inferenceId);

    Optional<Inference> findByJobId(String jobId);

    /** PENDING -> PROCESSING. */
    boolean markProcessing(String inferenceId, Instant startTime);

    /** PENDING/PROCESSING -> COMPLETED with the result payload. */
    boolean markCompleted(String inferenceId, String prediction, Instant endTime);

    /** PENDING/PROCESSING -> FAILED with a reason. */
    boolean markFailed(String inferenceId, String errorMessage, Instant endTime);
}
