package strokeseg.orchestrator.scheduler;

import strokeseg.orchestrator.exception.CommandException;
import strokeseg.orchestrator.exception.SubmissionException;
import strokeseg.orchestrator.exception.TransientQueryException;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class SlurmClientTest {

    /** Replays canned results and remembers what was run. */
    static class ScriptedRunner implements CommandRunner {
        final Deque<Function<List<String>, Result>> script = new ArrayDeque<>();
        final List<List<String>> commands = new ArrayList<>();
        final List<String> fileContents = new ArrayList<>();
        Duration lastTimeout;

        ScriptedRunner then(Result result) {
            script.add(cmd -> result);
            return this;
        }

        ScriptedRunner thenThrow(CommandException e) {
            script.add(cmd -> {
                throw e;
            });
            return this;
        }

        @Override
        public Result run(List<String> command, Duration timeout) {
            commands.add(command);
            lastTimeout = timeout;
            if (command.get(0).equals("sbatch")) {
                try {
                    fileContents.add(Files.readString(Path.of(command.get(1))));
                } catch (Exception e) {
                    fileContents.add(null);
                }
            }
            return script.poll().apply(command);
        }
    }

    private final ScriptedRunner runner = new ScriptedRunner();
    private final SlurmClient client = new SlurmClient(runner, new ScontrolParser(ZoneOffset.UTC),
            "sbatch", "scontrol", Duration.ofSeconds(7));

    @Test
    void submitWritesScriptRunsSbatchAndCleansUp() {
        runner.then(new CommandRunner.Result(0, "Submitted batch job 4242\n", ""));

        String id = client.submit("#!/bin/bash\necho m1\n");

        assertEquals("4242", id);
        assertEquals("sbatch", runner.commands.get(0).get(0));
        assertEquals("#!/bin/bash\necho m1\n", runner.fileContents.get(0));
        assertFalse(Files.exists(Path.of(runner.commands.get(0).get(1))), "temp file must be deleted");
        assertEquals(Duration.ofSeconds(7), runner.lastTimeout);
    }

    @Test
    void submitFailsOnNonZeroExit() {
        runner.then(new CommandRunner.Result(1, "", "sbatch: error: invalid partition"));

        SubmissionException e = assertThrows(SubmissionException.class, () -> client.submit("x"));
        assertTrue(e.getMessage().contains("invalid partition"));
        assertFalse(Files.exists(Path.of(runner.commands.get(0).get(1))));
    }

    @Test
    void submitFailsOnMalformedOutput() {
        runner.then(new CommandRunner.Result(0, "something unexpected", ""));

        SubmissionException e = assertThrows(SubmissionException.class, () -> client.submit("x"));
        assertTrue(e.getMessage().contains("Could not extract job ID"));
    }

    @Test
    void submitFailsWhenSbatchCannotRun() {
        runner.thenThrow(new CommandException("Failed to start sbatch: not found", null, false));

        assertThrows(SubmissionException.class, () -> client.submit("x"));
    }

    @Test
    void queryParsesScontrolOutput() {
        runner.then(new CommandRunner.Result(0, ScontrolParserTest.RUNNING_OUTPUT, ""));

        SchedulerJobInfo info = client.query("4242");

        assertEquals(List.of("scontrol", "show", "job", "4242"), runner.commands.get(0));
        assertEquals("RUNNING", info.rawState());
        assertNotNull(info.startTime());
    }

    @Test
    void queryReportsNotFoundWhenScontrolFails() {
        runner.then(new CommandRunner.Result(1, "", "slurm_load_jobs error: Invalid job id specified"));

        SchedulerJobInfo info = client.query("99");

        assertEquals(StateMapping.NOT_FOUND, info.rawState());
        assertEquals("99", info.externalId());
    }

    @Test
    void queryFailsTransientlyWhenControllerIsUnreachable() {
        runner.then(new CommandRunner.Result(1, "",
                "slurm_load_jobs error: Unable to contact slurm controller (connect failure)"));

        TransientQueryException e = assertThrows(TransientQueryException.class, () -> client.query("4242"));
        assertFalse(e.timedOut());
        assertTrue(e.getMessage().contains("Unable to contact slurm controller"));
    }

    @Test
    void queryTimeoutIsTransientAndMarkedTimedOut() {
        runner.thenThrow(new CommandException("scontrol timed out after 7s", null, true));

        TransientQueryException e = assertThrows(TransientQueryException.class, () -> client.query("1"));
        assertTrue(e.timedOut());
    }

    @Test
    void querySpawnFailureIsTransient() {
        runner.thenThrow(new CommandException("Failed to start scontrol", null, false));

        TransientQueryException e = assertThrows(TransientQueryException.class, () -> client.query("1"));
        assertFalse(e.timedOut());
    }
}
