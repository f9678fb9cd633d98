package strokeseg.orchestrator.submission;

import strokeseg.orchestrator.config.OrchestratorConfig;
import strokeseg.orchestrator.exception.PersistenceException;
import strokeseg.orchestrator.exception.SubmissionException;
import strokeseg.orchestrator.exception.ValidationException;
import strokeseg.orchestrator.model.Job;
import strokeseg.orchestrator.model.JobStatus;
import strokeseg.orchestrator.model.JobType;
import strokeseg.orchestrator.repository.JobRepository;
import strokeseg.orchestrator.scheduler.SchedulerClient;
import strokeseg.orchestrator.store.Database;
import strokeseg.orchestrator.template.TemplateRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Submission steps shared by the per-workflow facades.
 * <p>
 * The job and its workflow record are written in one transaction before anything reaches the
 * scheduler. The scheduler id is recorded once the script is accepted; a rejected submission
 * moves both records to FAILED, so every failure is already durable when the caller sees it.
 */
public class SubmissionSupport {

    private static final Logger log = LoggerFactory.getLogger(SubmissionSupport.class);

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss")
            .withZone(ZoneId.systemDefault());
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_.-]*");

    private final Database db;
    private final JobRepository jobRepository;
    private final TemplateRenderer renderer;
    private final SchedulerClient scheduler;
    private final OrchestratorConfig config;

    public SubmissionSupport(Database db, JobRepository jobRepository, TemplateRenderer renderer,
            SchedulerClient scheduler, OrchestratorConfig config) {
        this.db = db;
        this.jobRepository = jobRepository;
        this.renderer = renderer;
        this.scheduler = scheduler;
        this.config = config;
    }

    public OrchestratorConfig config() {
        return config;
    }

    public String newJobId() {
        return jobRepository.generateId();
    }

    public String timestamp(Instant instant) {
        return STAMP.format(instant);
    }

    /**
     * Render a script; missing variables surface as a validation failure before anything is submitted.
     */
    public String render(String templateName, Map<String, String> variables) {
        return renderer.render(templateName, variables);
    }

    /**
     * Record the job with its workflow record, submit the script, then store the scheduler id.
     * The job has no external id until the scheduler accepted it, so no monitor picks it up in between.
     *
     * @param jobType         type of the job
     * @param jobId           pre-generated job id, referenced by the workflow record and the script
     * @param workflowId      id of the workflow record written by {@code createWorkflow}
     * @param script          rendered script
     * @param outputDirectory directory to create before submitting, may be null
     * @param createWorkflow  writes the workflow record for the new job; runs in the job's transaction
     * @param failWorkflow    marks the workflow record FAILED with (error message, end time)
     * @throws SubmissionException if the scheduler did not accept the job; the job is recorded as FAILED
     *                             and {@link SubmissionException#jobId()} names it
     */
    public SubmissionResult submit(JobType jobType, String jobId, String workflowId, String script,
            String outputDirectory, Consumer<Job> createWorkflow, BiConsumer<String, Instant> failWorkflow) {
        Job job = Job.builder()
                .id(jobId)
                .jobType(jobType)
                .status(JobStatus.PENDING)
                .submissionArtifact(script)
                .createdAt(Instant.now())
                .build();
        db.inTransaction(() -> {
            jobRepository.save(job);
            createWorkflow.accept(job);
        });

        String externalId;
        try {
            prepareDirectory(outputDirectory);
            externalId = scheduler.submit(script);
        } catch (SubmissionException e) {
            recordFailure(jobType, jobId, e.getMessage(), failWorkflow);
            throw e.withJobId(jobId);
        } catch (RuntimeException e) {
            SubmissionException failure = new SubmissionException("Submission failed: " + e.getMessage(), e);
            recordFailure(jobType, jobId, failure.getMessage(), failWorkflow);
            throw failure.withJobId(jobId);
        }

        boolean assigned;
        try {
            assigned = jobRepository.assignExternalId(jobId, externalId);
        } catch (RuntimeException e) {
            log.error("{} job {} was accepted by the scheduler as {} but the id could not be recorded",
                    jobType, jobId, externalId, e);
            throw e;
        }
        if (!assigned) {
            log.error("{} job {} was accepted by the scheduler as {} but is no longer awaiting an id",
                    jobType, jobId, externalId);
            throw new PersistenceException("Job " + jobId + " is no longer awaiting an external id", null);
        }

        log.info("{} job {} submitted (workflow {}, external {})", jobType, jobId, workflowId, externalId);
        return new SubmissionResult(workflowId, jobId, externalId);
    }

    private void recordFailure(JobType jobType, String jobId, String message,
            BiConsumer<String, Instant> failWorkflow) {
        Instant now = Instant.now();
        db.inTransaction(() -> {
            jobRepository.markFinished(jobId, JobStatus.PENDING, JobStatus.FAILED, null, now, message);
            failWorkflow.accept(message, now);
        });
        log.warn("{} job {} failed at submission: {}", jobType, jobId, message);
    }

    // ===== validation helpers =====

    public static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
        if (value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0) {
            throw new ValidationException(field + " must be a single line");
        }
        return value.trim();
    }

    /** Names that end up in paths and command lines. */
    public static String requireIdentifier(String value, String field) {
        String text = requireText(value, field);
        if (!IDENTIFIER.matcher(text).matches()) {
            throw new ValidationException(field + " must be letters, digits, '_', '-' or '.', "
                    + "starting with a letter or digit: " + text);
        }
        return text;
    }

    public static int requireNonNegative(int value, String field) {
        if (value < 0) {
            throw new ValidationException(field + " must not be negative: " + value);
        }
        return value;
    }

    private void prepareDirectory(String directory) {
        if (directory == null || !config.prepareOutputDirectories()) {
            return;
        }
        try {
            Files.createDirectories(Path.of(directory));
        } catch (IOException e) {
            throw new SubmissionException("Failed to create output directory " + directory + ": " + e.getMessage(), e);
        }
    }
}
