package strokeseg.orchestrator.scheduler;

import strokeseg.orchestrator.exception.CommandException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}.
 * A process that outlives its timeout is destroyed forcibly.
 */
public class ProcessCommandRunner implements CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessCommandRunner.class);

    @Override
    public Result run(List<String> command, Duration timeout) {
        log.debug("Executing command: {}", command);

        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException e) {
            throw new CommandException("Failed to start " + command.get(0) + ": " + e.getMessage(), e, false);
        }

        // drain both pipes so a chatty process cannot block on a full buffer
        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readAll(process.getErrorStream()));

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new CommandException(command.get(0) + " timed out after " + timeout.toSeconds() + "s", null, true);
            }
            int exitCode = process.exitValue();
            Result result = new Result(exitCode, stdout.get(5, TimeUnit.SECONDS), stderr.get(5, TimeUnit.SECONDS));
            log.debug("Command {} exited with {}", command.get(0), exitCode);
            return result;
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new CommandException(command.get(0) + " interrupted", e, false);
        } catch (ExecutionException | TimeoutException e) {
            throw new CommandException("Failed to read output of " + command.get(0), e, false);
        }
    }

    private static String readAll(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
