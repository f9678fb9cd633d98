package strokeseg.orchestrator.model;

/**
 * Status of an evaluation request, a projection of its job's status.
 */
public enum EvaluationStatus {
    PENDING,
    EVALUATING,
    COMPLETED,
    FAILED
}
