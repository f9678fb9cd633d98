package strokeseg.orchestrator.model;

/**
 * Kind of work a scheduler job performs. Each type is owned by exactly one monitor.
 */
public enum JobType {
    TRAINING,
    INFERENCE,
    EVALUATION
}
