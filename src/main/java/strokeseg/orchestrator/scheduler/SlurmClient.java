package strokeseg.orchestrator.scheduler;

import strokeseg.orchestrator.config.OrchestratorConfig;
import strokeseg.orchestrator.exception.CommandException;
import strokeseg.orchestrator.exception.SubmissionException;
import strokeseg.orchestrator.exception.TransientQueryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * SLURM implementation of {@link SchedulerClient}.
 * <ul>
 * <li>submit: writes the script to a temp file, runs {@code sbatch <file>} and reads
 * "Submitted batch job N"; the file is always deleted</li>
 * <li>query: runs {@code scontrol show job <id>}; "Invalid job id specified" means SLURM no longer
 * lists the job and is reported as {@link StateMapping#NOT_FOUND}, any other failure is transient</li>
 * </ul>
 */
public class SlurmClient implements SchedulerClient {

    private static final Logger log = LoggerFactory.getLogger(SlurmClient.class);

    private static final Pattern SUBMITTED = Pattern.compile("Submitted batch job (\\d+)");
    private static final Pattern INVALID_JOB_ID = Pattern.compile("Invalid job id specified", Pattern.CASE_INSENSITIVE);

    private final CommandRunner runner;
    private final ScontrolParser parser;
    private final String sbatchCommand;
    private final String scontrolCommand;
    private final Duration timeout;

    public SlurmClient(CommandRunner runner, OrchestratorConfig config) {
        this(runner, new ScontrolParser(), config.sbatchCommand(), config.scontrolCommand(),
                config.schedulerCommandTimeout());
    }

    public SlurmClient(CommandRunner runner, ScontrolParser parser, String sbatchCommand,
            String scontrolCommand, Duration timeout) {
        this.runner = runner;
        this.parser = parser;
        this.sbatchCommand = sbatchCommand;
        this.scontrolCommand = scontrolCommand;
        this.timeout = timeout;
    }

    @Override
    public String submit(String script) {
        Path file = null;
        try {
            file = Files.createTempFile("strokeseg-", ".sbatch");
            Files.writeString(file, script, StandardCharsets.UTF_8);

            CommandRunner.Result result = runner.run(List.of(sbatchCommand, file.toString()), timeout);
            if (!result.succeeded()) {
                throw new SubmissionException("sbatch exited with code " + result.exitCode() + ": "
                        + firstNonBlank(result.stderr(), result.stdout()));
            }

            Matcher m = SUBMITTED.matcher(result.stdout());
            if (!m.find()) {
                throw new SubmissionException("Could not extract job ID from sbatch output: " + result.stdout().trim());
            }

            String externalId = m.group(1);
            log.info("sbatch job submitted - SLURM job ID: {}", externalId);
            return externalId;
        } catch (IOException e) {
            throw new SubmissionException("Failed to write sbatch file: " + e.getMessage(), e);
        } catch (CommandException e) {
            throw new SubmissionException("sbatch failed: " + e.getMessage(), e);
        } finally {
            deleteQuietly(file);
        }
    }

    @Override
    public SchedulerJobInfo query(String externalId) {
        CommandRunner.Result result;
        try {
            result = runner.run(List.of(scontrolCommand, "show", "job", externalId), timeout);
        } catch (CommandException e) {
            throw new TransientQueryException("scontrol failed for job " + externalId + ": " + e.getMessage(),
                    e, e.timedOut());
        }

        if (!result.succeeded()) {
            String output = firstNonBlank(result.stderr(), result.stdout());
            if (INVALID_JOB_ID.matcher(output).find()) {
                log.info("Job {} not found in SLURM queue - treating as finished", externalId);
                return SchedulerJobInfo.notFound(externalId);
            }
            // anything else, e.g. an unreachable controller, says nothing about the job
            throw new TransientQueryException("scontrol exited with code " + result.exitCode() + " for job "
                    + externalId + ": " + output, null);
        }

        SchedulerJobInfo info = parser.toJobInfo(externalId, result.stdout());
        log.debug("Job {} state: {}", externalId, info.rawState());
        return info;
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) {
                return v.trim();
            }
        }
        return "";
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete sbatch file {}: {}", file, e.getMessage());
        }
    }
}
