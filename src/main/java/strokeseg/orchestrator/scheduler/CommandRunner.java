package strokeseg.orchestrator.scheduler;

import strokeseg.orchestrator.exception.CommandException;

import java.time.Duration;
import java.util.List;

/**
 * Runs an external command and captures its output.
 */
public interface CommandRunner {

    /**
     * Output of a finished command.
     */
    record Result(int exitCode, String stdout, String stderr) {
        public boolean succeeded() {
            return exitCode == 0;
        }
    }

    /**
     * @param command program and arguments
     * @param timeout upper bound for the whole run
     * @return exit code and captured output
     * @throws CommandException if the process could not start or exceeded {@code timeout}
     */
    Result run(List<String> command, Duration timeout);
}
