package strokeseg.orchestrator.scheduler;

import strokeseg.orchestrator.exception.SubmissionException;
import strokeseg.orchestrator.exception.TransientQueryException;

/**
 * Boundary to the external batch scheduler.
 * Both calls block and are bounded by the configured command timeout.
 */
public interface SchedulerClient {

    /**
     * Submit a rendered job script.
     *
     * @param script script content
     * @return the scheduler's job id
     * @throws SubmissionException if the scheduler rejected the job or could not be reached
     */
    String submit(String script);

    /**
     * Look up the current state of a submitted job.
     *
     * @param externalId the scheduler's job id
     * @return what the scheduler reports; {@code rawState} may be null when the output was unusable
     * @throws TransientQueryException if the scheduler could not be asked this time
     */
    SchedulerJobInfo query(String externalId);
}
