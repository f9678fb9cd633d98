package strokeseg.orchestrator.repository;

import strokeseg.orchestrator.model.Evaluation;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository interface for evaluation requests.
 */
public interface EvaluationRepository {

    void save(Evaluation evaluation);

    Optional<Evaluation> findById(String evaluationId);

    Optional<Evaluation> findByJobId(String jobId);

    /** PENDING -> EVALUATING. */
    boolean markEvaluating(String evaluationId, Instant startTime);

    /** PENDING/EVALUATING -> COMPLETED with structured results. */
    boolean markCompleted(String evaluationId, String results, Instant endTime);

    /** PENDING/EVALUATING -> FAILED with a reason. */
    boolean markFailed(String evaluationId, String errorMessage, Instant endTime);
}
