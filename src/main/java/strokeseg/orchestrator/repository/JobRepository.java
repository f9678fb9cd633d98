package strokeseg.orchestrator.repository;

import strokeseg.orchestrator.model.Job;
import strokeseg.orchestrator.model.JobStatus;
import strokeseg.orchestrator.model.JobType;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Job persistence.
 * Every status write is a compare-and-swap on the status the caller observed.
 */
public interface JobRepository {

    /**
     * Save a new job.
     *
     * @param job the job to save
     */
    void save(Job job);

    /**
     * Find a job by ID.
     *
     * @param jobId the job ID
     * @return the job if found
     */
    Optional<Job> findById(String jobId);

    /**
     * Get jobs by status.
     *
     * @param status the status filter
     * @return list of jobs, oldest first
     */
    List<Job> findByStatus(JobStatus status);

    /**
     * Non-terminal jobs of one type that reached the scheduler (external id set).
     *
     * @param jobType the job type
     * @return list of jobs, oldest first
     */
    List<Job> findMonitorable(JobType jobType);

    /**
     * Record the scheduler id of a freshly submitted job.
     * Only a PENDING job without an external id is updated; the id never changes once set.
     *
     * @param jobId      the job ID
     * @param externalId id assigned by the scheduler
     * @return true if the id was recorded
     */
    boolean assignExternalId(String jobId, String externalId);

    /**
     * Move a job to RUNNING and set startTime if not already set.
     *
     * @param jobId     the job ID
     * @param expected  the status the caller observed
     * @param startTime when the scheduler started the job
     * @return true if the job was still in {@code expected} and got updated
     */
    boolean markRunning(String jobId, JobStatus expected, Instant startTime);

    /**
     * Move a job to a terminal status and set endTime (and startTime if still unset).
     *
     * @param jobId        the job ID
     * @param expected     the status the caller observed
     * @param terminal     COMPLETED or FAILED
     * @param startTime    scheduler start time, may be null
     * @param endTime      scheduler end time
     * @param errorMessage reason for FAILED, null otherwise
     * @return true if the job was still in {@code expected} and got updated
     */
    boolean markFinished(String jobId, JobStatus expected, JobStatus terminal,
            Instant startTime, Instant endTime, String errorMessage);

    /**
     * Store the consecutive unknown-observation counter.
     *
     * @param jobId    the job ID
     * @param expected the status the caller observed
     * @param count    new counter value
     * @return true if updated
     */
    boolean updateUnknownObservations(String jobId, JobStatus expected, int count);

    /**
     * Generate a new unique Job ID.
     *
     * @return unique UUID string
     */
    String generateId();
}
