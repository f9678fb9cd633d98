package strokeseg.orchestrator.submission;

/**
 * Ids of an accepted submission.
 *
 * @param workflowId    training, inference or evaluation id
 * @param jobId         internal job id
 * @param externalJobId scheduler job id
 */
public record SubmissionResult(String workflowId, String jobId, String externalJobId) {
}
