package strokeseg.orchestrator.repository;

import strokeseg.orchestrator.model.Training;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository interface for training requests.
 */
public interface TrainingRepository {

    void save(Training training);

    Optional<Training> findById(String trainingId);

    Optional<Training> findByJobId(String jobId);

    /**
     * TRAINING -> TRAINED.
     *
     * @return true if the training was still TRAINING
     */
    boolean markTrained(String trainingId, Instant endTime);

    /**
     * TRAINING -> FAILED with a reason.
     *
     * @return true if the training was still TRAINING
     */
    boolean markFailed(String trainingId, String errorMessage, Instant endTime);
}
