package strokeseg.orchestrator.exception;

/**
 * The scheduler rejected a job or could not be reached to accept it.
 * When thrown from a submission facade the job has already been recorded as FAILED
 * and {@link #jobId()} names it.
 */
public class SubmissionException extends OrchestratorException {

    private final String jobId;

    public SubmissionException(String message) {
        this(message, null, null);
    }

    public SubmissionException(String message, Throwable cause) {
        this(message, cause, null);
    }

    private SubmissionException(String message, Throwable cause, String jobId) {
        super(message, cause);
        this.jobId = jobId;
    }

    /** Same failure, annotated with the id of the FAILED job that records it. */
    public SubmissionException withJobId(String jobId) {
        SubmissionException annotated = new SubmissionException(getMessage(), getCause(), jobId);
        annotated.setStackTrace(getStackTrace());
        return annotated;
    }

    public String jobId() {
        return jobId;
    }
}
