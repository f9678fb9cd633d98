package strokeseg.orchestrator.model;

/**
 * Status of a training request, a projection of its job's status.
 */
public enum TrainingStatus {
    TRAINING,
    TRAINED,
    FAILED
}
