package strokeseg.orchestrator.monitor;

import strokeseg.orchestrator.exception.TransientQueryException;
import strokeseg.orchestrator.exception.ValidationException;
import strokeseg.orchestrator.model.Job;
import strokeseg.orchestrator.model.JobStatus;
import strokeseg.orchestrator.model.JobType;
import strokeseg.orchestrator.repository.JobRepository;
import strokeseg.orchestrator.scheduler.SchedulerClient;
import strokeseg.orchestrator.scheduler.SchedulerJobInfo;
import strokeseg.orchestrator.store.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Reconciles the jobs of one type against the scheduler.
 * <p>
 * For every non-terminal job with an external id:
 * <ol>
 * <li>query the scheduler; a timed-out query counts as an unknown observation,
 * any other query failure leaves the job untouched until the next cycle</li>
 * <li>run the observation through the {@link JobStateMachine}</li>
 * <li>persist the result with a compare-and-swap on the status that was read</li>
 * <li>on a terminal transition, write the terminal status and run the type's side effect
 * in one transaction, so a failing side effect leaves the job where it was</li>
 * </ol>
 * A failure on one job is logged and counted, the rest of the cycle continues.
 * Subclasses only supply the side effects.
 */
public abstract class JobMonitor {

    private static final Logger log = LoggerFactory.getLogger(JobMonitor.class);

    private final JobType jobType;
    protected final Database db;
    protected final JobRepository jobRepository;
    private final SchedulerClient scheduler;
    private final JobStateMachine stateMachine;

    protected JobMonitor(JobType jobType, Database db, JobRepository jobRepository,
            SchedulerClient scheduler, JobStateMachine stateMachine) {
        this.jobType = jobType;
        this.db = db;
        this.jobRepository = jobRepository;
        this.scheduler = scheduler;
        this.stateMachine = stateMachine;
    }

    public JobType jobType() {
        return jobType;
    }

    /**
     * Run one full poll cycle.
     */
    public CycleReport pollOnce() {
        return pollOnce(() -> false);
    }

    /**
     * Run one poll cycle, checking {@code stopRequested} between jobs.
     * The job being reconciled when stop is requested is always finished first.
     */
    public CycleReport pollOnce(BooleanSupplier stopRequested) {
        List<Job> jobs = jobRepository.findMonitorable(jobType);
        if (jobs.isEmpty()) {
            log.debug("No {} jobs to monitor", jobType);
            return CycleReport.empty(jobType);
        }

        int polled = 0;
        int transitioned = 0;
        int unchanged = 0;
        int errors = 0;

        for (Job job : jobs) {
            if (stopRequested.getAsBoolean()) {
                log.info("Stop requested, {} cycle ends after {} of {} jobs", jobType, polled, jobs.size());
                break;
            }
            polled++;
            try {
                if (reconcile(job)) {
                    transitioned++;
                } else {
                    unchanged++;
                }
            } catch (TransientQueryException e) {
                errors++;
                log.warn("Could not query {} job {} (external {}): {}",
                        jobType, job.id(), job.externalId(), e.getMessage());
            } catch (Exception e) {
                errors++;
                log.error("Failed to reconcile {} job {} (external {})", jobType, job.id(), job.externalId(), e);
            }
        }

        CycleReport report = new CycleReport(jobType, polled, transitioned, unchanged, errors);
        if (transitioned > 0 || errors > 0) {
            log.info("{} monitor: {} polled, {} transitioned, {} errors", jobType, polled, transitioned, errors);
        } else {
            log.debug("{} monitor: {} polled, no changes", jobType, polled);
        }
        return report;
    }

    /**
     * Reconcile a single job right now, outside the regular cycle.
     *
     * @return the job as persisted afterwards
     * @throws ValidationException if the job does not exist or belongs to another monitor
     * @throws TransientQueryException if the scheduler could not be queried
     */
    public Job pollJobOnce(String jobId) {
        Job job = jobRepository.findById(jobId)
                .orElseThrow(() -> new ValidationException("Job not found: " + jobId));
        if (job.jobType() != jobType) {
            throw new ValidationException("Job " + jobId + " is a " + job.jobType() + " job, not " + jobType);
        }
        if (job.isMonitorable()) {
            reconcile(job);
        } else {
            log.debug("Job {} is not monitorable (status {}, external id {})", jobId, job.status(), job.externalId());
        }
        return jobRepository.findById(jobId).orElseThrow();
    }

    /**
     * @return true if the job changed status
     */
    boolean reconcile(Job job) {
        SchedulerJobInfo info;
        Reconciliation result;
        try {
            info = scheduler.query(job.externalId());
            result = stateMachine.reconcile(job.status(), job.unknownObservations(), info.rawState());
        } catch (TransientQueryException e) {
            if (!e.timedOut()) {
                throw e;
            }
            log.warn("Status query for job {} (external {}) timed out", job.id(), job.externalId());
            info = null;
            result = stateMachine.unknown(job.status(), job.unknownObservations(), "query timed out");
        }

        return switch (result.outcome()) {
            case NOOP -> false;
            case UNCHANGED -> {
                if (job.unknownObservations() > 0) {
                    jobRepository.updateUnknownObservations(job.id(), job.status(), 0);
                }
                log.debug("Job {} unchanged at {} (scheduler state {})", job.id(), job.status(), info.rawState());
                yield false;
            }
            case UNKNOWN -> {
                jobRepository.updateUnknownObservations(job.id(), job.status(), result.unknownObservations());
                log.warn("Job {} (external {}): unrecognised scheduler state '{}', {} of {} before escalation",
                        job.id(), job.externalId(), info == null ? "<timeout>" : info.rawState(),
                        result.unknownObservations(), stateMachine.unknownThreshold());
                yield false;
            }
            case ADVANCE -> markRunning(job, info);
            case TERMINAL, EXHAUSTED -> finish(job, info, result);
        };
    }

    private boolean markRunning(Job job, SchedulerJobInfo info) {
        Instant startTime = info.startTime() != null ? info.startTime() : Instant.now();

        return db.inTransaction(conn -> {
            if (!jobRepository.markRunning(job.id(), job.status(), startTime)) {
                log.debug("Job {} moved on concurrently, skipping RUNNING", job.id());
                return false;
            }
            onRunning(job, startTime);
            log.info("{} job {} (external {}): {} -> RUNNING", jobType, job.id(), job.externalId(), job.status());
            return true;
        });
    }

    private boolean finish(Job job, SchedulerJobInfo info, Reconciliation result) {
        JobStatus terminal = result.status();
        Instant startTime = info != null ? info.startTime() : null;
        Instant endTime = info != null && info.endTime() != null ? info.endTime() : Instant.now();
        String errorMessage = null;
        if (terminal == JobStatus.FAILED) {
            errorMessage = result.errorMessage() != null ? result.errorMessage() : info.failureDescription();
        }
        String error = errorMessage;

        boolean applied = db.inTransaction(conn -> {
            // the status write takes the row first; a concurrent cycle that loses here skips the side effect
            if (!jobRepository.markFinished(job.id(), job.status(), terminal, startTime, endTime, error)) {
                return false;
            }
            if (result.effect() == Reconciliation.TerminalEffect.ON_COMPLETED) {
                onCompleted(job, endTime);
            } else {
                onFailed(job, error, endTime);
            }
            return true;
        });

        if (!applied) {
            log.debug("Job {} moved on concurrently, skipping {}", job.id(), terminal);
        } else if (result.exhaustion() != null) {
            log.warn("{} job {} (external {}): {} -> FAILED after {} unrecognised observations, last '{}'",
                    jobType, job.id(), job.externalId(), job.status(),
                    result.exhaustion().observations(), result.exhaustion().lastRawState());
        } else if (terminal == JobStatus.FAILED) {
            log.warn("{} job {} (external {}): {} -> FAILED: {}", jobType, job.id(), job.externalId(),
                    job.status(), error);
        } else {
            log.info("{} job {} (external {}): {} -> COMPLETED", jobType, job.id(), job.externalId(), job.status());
        }
        return applied;
    }

    /**
     * Called inside the transaction that moved the job to RUNNING.
     */
    protected void onRunning(Job job, Instant startTime) {
    }

    /**
     * Called inside the transaction that moved the job to COMPLETED.
     * Must be idempotent; throwing rolls the status write back.
     */
    protected abstract void onCompleted(Job job, Instant endTime);

    /**
     * Called inside the transaction that moved the job to FAILED.
     */
    protected abstract void onFailed(Job job, String errorMessage, Instant endTime);
}
