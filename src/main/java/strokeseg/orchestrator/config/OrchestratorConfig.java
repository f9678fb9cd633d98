package strokeseg.orchestrator.config;

import org.ini4j.Ini;
import org.ini4j.Profile;
import strokeseg.orchestrator.model.JobStatus;
import strokeseg.orchestrator.scheduler.StateMapping;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Configuration holder for orchestrator settings.
 * Built once at startup and passed to every component that needs it.
 * All settings have sensible defaults.
 */
public final class OrchestratorConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/strokeseg;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Monitor settings
    private Duration pollInterval = Duration.ofSeconds(30);
    private Duration initialDelay = Duration.ofSeconds(5);
    private int unknownStateThreshold = 5;
    private Duration shutdownTimeout = Duration.ofSeconds(10);

    // Scheduler settings
    private Duration schedulerCommandTimeout = Duration.ofSeconds(30);
    private String sbatchCommand = "sbatch";
    private String scontrolCommand = "scontrol";
    private StateMapping stateMapping = StateMapping.slurmDefaults();

    // Paths
    private String modelsBasePath = "./models";
    private String templateDirectory = "templates";
    private boolean prepareOutputDirectories = true;

    private OrchestratorConfig() {
    }

    public static OrchestratorConfig defaults() {
        return new OrchestratorConfig();
    }

    public static OrchestratorConfig fromEnv() {
        return applyEnv(new OrchestratorConfig());
    }

    /**
     * Load settings from an INI file, then apply environment overrides.
     * Sections: [database], [monitor], [scheduler], [paths], [state_mapping].
     */
    public static OrchestratorConfig fromIni(Path iniFile) throws IOException {
        Ini ini = new Ini(iniFile.toFile());
        OrchestratorConfig config = new OrchestratorConfig();

        Profile.Section database = ini.get("database");
        if (database != null) {
            config.databaseUrl = opt(database, "url", config.databaseUrl);
            config.databasePoolSize = Integer.parseInt(opt(database, "pool_size", String.valueOf(config.databasePoolSize)));
        }

        Profile.Section monitor = ini.get("monitor");
        if (monitor != null) {
            config.pollInterval = seconds(monitor, "poll_interval_seconds", config.pollInterval);
            config.initialDelay = seconds(monitor, "initial_delay_seconds", config.initialDelay);
            config.shutdownTimeout = seconds(monitor, "shutdown_timeout_seconds", config.shutdownTimeout);
            config.withUnknownStateThreshold(Integer.parseInt(
                    opt(monitor, "unknown_state_threshold", String.valueOf(config.unknownStateThreshold))));
        }

        Profile.Section scheduler = ini.get("scheduler");
        if (scheduler != null) {
            config.schedulerCommandTimeout = seconds(scheduler, "command_timeout_seconds", config.schedulerCommandTimeout);
            config.sbatchCommand = opt(scheduler, "sbatch", config.sbatchCommand);
            config.scontrolCommand = opt(scheduler, "scontrol", config.scontrolCommand);
        }

        Profile.Section paths = ini.get("paths");
        if (paths != null) {
            config.modelsBasePath = opt(paths, "models_base_path", config.modelsBasePath);
            config.templateDirectory = opt(paths, "template_directory", config.templateDirectory);
            config.prepareOutputDirectories = Boolean.parseBoolean(
                    opt(paths, "prepare_output_directories", String.valueOf(config.prepareOutputDirectories)));
        }

        Profile.Section mapping = ini.get("state_mapping");
        if (mapping != null) {
            Map<String, JobStatus> overrides = new LinkedHashMap<>();
            for (String state : mapping.keySet()) {
                overrides.put(state, JobStatus.valueOf(mapping.get(state).trim().toUpperCase(Locale.ROOT)));
            }
            config.stateMapping = config.stateMapping.with(overrides);
        }

        return applyEnv(config);
    }

    private static OrchestratorConfig applyEnv(OrchestratorConfig config) {
        String dbUrl = System.getenv("STROKESEG_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String interval = System.getenv("STROKESEG_POLL_INTERVAL_SECONDS");
        if (interval != null && !interval.isBlank()) {
            config.pollInterval = Duration.ofSeconds(Long.parseLong(interval.trim()));
        }

        String threshold = System.getenv("STROKESEG_UNKNOWN_THRESHOLD");
        if (threshold != null && !threshold.isBlank()) {
            config.withUnknownStateThreshold(Integer.parseInt(threshold.trim()));
        }

        String modelsPath = System.getenv("STROKESEG_MODELS_PATH");
        if (modelsPath != null && !modelsPath.isBlank()) {
            config.modelsBasePath = modelsPath;
        }

        String timeout = System.getenv("STROKESEG_COMMAND_TIMEOUT_SECONDS");
        if (timeout != null && !timeout.isBlank()) {
            config.schedulerCommandTimeout = Duration.ofSeconds(Long.parseLong(timeout.trim()));
        }

        return config;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public Duration initialDelay() {
        return initialDelay;
    }

    public int unknownStateThreshold() {
        return unknownStateThreshold;
    }

    public Duration shutdownTimeout() {
        return shutdownTimeout;
    }

    public Duration schedulerCommandTimeout() {
        return schedulerCommandTimeout;
    }

    public String sbatchCommand() {
        return sbatchCommand;
    }

    public String scontrolCommand() {
        return scontrolCommand;
    }

    public StateMapping stateMapping() {
        return stateMapping;
    }

    public String modelsBasePath() {
        return modelsBasePath;
    }

    public String templateDirectory() {
        return templateDirectory;
    }

    public boolean prepareOutputDirectories() {
        return prepareOutputDirectories;
    }

    // Fluent setters for testing/customization
    public OrchestratorConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public OrchestratorConfig withDatabasePoolSize(int poolSize) {
        this.databasePoolSize = poolSize;
        return this;
    }

    public OrchestratorConfig withPollInterval(Duration interval) {
        this.pollInterval = interval;
        return this;
    }

    public OrchestratorConfig withInitialDelay(Duration delay) {
        this.initialDelay = delay;
        return this;
    }

    public OrchestratorConfig withUnknownStateThreshold(int threshold) {
        if (threshold < 1) {
            throw new IllegalArgumentException("unknownStateThreshold must be at least 1");
        }
        this.unknownStateThreshold = threshold;
        return this;
    }

    public OrchestratorConfig withShutdownTimeout(Duration timeout) {
        this.shutdownTimeout = timeout;
        return this;
    }

    public OrchestratorConfig withSchedulerCommandTimeout(Duration timeout) {
        this.schedulerCommandTimeout = timeout;
        return this;
    }

    public OrchestratorConfig withSbatchCommand(String command) {
        this.sbatchCommand = command;
        return this;
    }

    public OrchestratorConfig withScontrolCommand(String command) {
        this.scontrolCommand = command;
        return this;
    }

    public OrchestratorConfig withStateMapping(StateMapping mapping) {
        this.stateMapping = mapping;
        return this;
    }

    public OrchestratorConfig withModelsBasePath(String path) {
        this.modelsBasePath = path;
        return this;
    }

    public OrchestratorConfig withTemplateDirectory(String directory) {
        this.templateDirectory = directory;
        return this;
    }

    public OrchestratorConfig withPrepareOutputDirectories(boolean prepare) {
        this.prepareOutputDirectories = prepare;
        return this;
    }

    // ===== helpers =====
    private static String opt(Profile.Section s, String key, String def) {
        String v = s.get(key);
        return (v == null || v.isBlank()) ? def : v.trim();
    }

    private static Duration seconds(Profile.Section s, String key, Duration def) {
        String v = s.get(key);
        return (v == null || v.isBlank()) ? def : Duration.ofSeconds(Long.parseLong(v.trim()));
    }

    @Override
    public String toString() {
        return "OrchestratorConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", pollInterval=" + pollInterval +
                ", unknownStateThreshold=" + unknownStateThreshold +
                ", commandTimeout=" + schedulerCommandTimeout +
                ", modelsBasePath='" + modelsBasePath + '\'' +
                '}';
    }
}
