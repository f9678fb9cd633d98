package strokeseg.orchestrator.model;

/**
 * Status of an inference request, a projection of its job's status.
 */
public enum InferenceStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
}
