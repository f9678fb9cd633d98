package strokeseg.orchestrator.repository;

import strokeseg.orchestrator.model.Model;

import java.util.Optional;

/**
 * Repository interface for trained models.
 * At most one model exists per training.
 */
public interface ModelRepository {

    void save(Model model);

    Optional<Model> findById(String modelId);

    Optional<Model> findByTrainingId(String trainingId);

    /**
     * Most recently created model with the given name.
     */
    Optional<Model> findByName(String modelName);
}
