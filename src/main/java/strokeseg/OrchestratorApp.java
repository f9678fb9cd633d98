package strokeseg;

import strokeseg.orchestrator.config.Dependencies;
import strokeseg.orchestrator.config.OrchestratorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;

/**
 * Process entry point: wires the orchestrator and keeps the job monitors running until shutdown.
 * <p>
 * Usage: {@code java -jar strokeseg-orchestrator.jar [orchestrator.ini]}
 */
public final class OrchestratorApp {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorApp.class);

    private OrchestratorApp() {
    }

    public static void main(String[] args) throws IOException, InterruptedException {
        OrchestratorConfig config = loadConfig(args);
        Dependencies deps = Dependencies.create(config);
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested");
            deps.close();
            stopped.countDown();
        }, "strokeseg-shutdown"));

        deps.startMonitors();
        log.info("Orchestrator running, press Ctrl+C to stop");
        stopped.await();
    }

    private static OrchestratorConfig loadConfig(String[] args) throws IOException {
        if (args.length > 0) {
            Path ini = Path.of(args[0]);
            if (!Files.isRegularFile(ini)) {
                throw new IOException("Config file not found: " + ini);
            }
            log.info("Loading config from {}", ini);
            return OrchestratorConfig.fromIni(ini);
        }
        return OrchestratorConfig.fromEnv();
    }
}
