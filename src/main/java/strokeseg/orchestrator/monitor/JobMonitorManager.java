package strokeseg.orchestrator.monitor;

import strokeseg.orchestrator.config.OrchestratorConfig;
import strokeseg.orchestrator.exception.ValidationException;
import strokeseg.orchestrator.model.Job;
import strokeseg.orchestrator.model.JobType;
import strokeseg.orchestrator.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs every registered {@link JobMonitor} on a background timer.
 * <p>
 * Uses a single-threaded executor with a fixed delay, so cycles never overlap within one manager.
 * A failing monitor is logged and the loop continues with the next one and the next cycle.
 */
public class JobMonitorManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JobMonitorManager.class);

    private final Map<JobType, JobMonitor> monitors = new EnumMap<>(JobType.class);
    private final JobRepository jobRepository;
    private final Duration pollInterval;
    private final Duration initialDelay;
    private final Duration shutdownTimeout;

    private ScheduledExecutorService executor;
    private volatile boolean running = false;
    private volatile boolean stopRequested = false;

    private volatile Instant lastCycleTime;
    private volatile String lastError;
    private final AtomicLong cycles = new AtomicLong();

    public JobMonitorManager(List<JobMonitor> monitors, JobRepository jobRepository, OrchestratorConfig config) {
        for (JobMonitor monitor : monitors) {
            if (this.monitors.put(monitor.jobType(), monitor) != null) {
                throw new IllegalArgumentException("Duplicate monitor for " + monitor.jobType());
            }
        }
        this.jobRepository = jobRepository;
        this.pollInterval = config.pollInterval();
        this.initialDelay = config.initialDelay();
        this.shutdownTimeout = config.shutdownTimeout();
    }

    /**
     * Start polling. Starting a running manager only logs a warning.
     */
    public synchronized void start() {
        if (running) {
            log.warn("Monitor manager already running");
            return;
        }

        stopRequested = false;
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "strokeseg-job-monitor");
            t.setDaemon(true);
            return t;
        });
        executor.scheduleWithFixedDelay(
                this::runCycleSafely,
                initialDelay.toMillis(),
                pollInterval.toMillis(),
                TimeUnit.MILLISECONDS);
        running = true;

        log.info("Monitor manager started: {} monitors every {}ms", monitors.size(), pollInterval.toMillis());
    }

    /**
     * Stop polling. The cycle in flight finishes the job it is working on, then this returns,
     * waiting at most the configured shutdown timeout.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }

        running = false;
        stopRequested = true;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
                log.warn("Monitor manager forcefully stopped after {}ms", shutdownTimeout.toMillis());
            } else {
                log.info("Monitor manager stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public MonitorHealth health() {
        return new MonitorHealth(running, lastCycleTime, cycles.get(), lastError);
    }

    /**
     * Run every monitor once on the calling thread.
     */
    public List<CycleReport> runCycle() {
        List<CycleReport> reports = new ArrayList<>();
        String error = null;

        for (JobMonitor monitor : monitors.values()) {
            if (stopRequested) {
                break;
            }
            try {
                reports.add(monitor.pollOnce(() -> stopRequested));
            } catch (Exception e) {
                error = monitor.jobType() + " monitor: " + e.getMessage();
                log.error("{} monitor cycle failed", monitor.jobType(), e);
            }
        }

        lastError = error;
        lastCycleTime = Instant.now();
        cycles.incrementAndGet();
        return Collections.unmodifiableList(reports);
    }

    /**
     * Reconcile one job immediately with the monitor owning its type.
     */
    public Job pollJobOnce(String jobId) {
        Job job = jobRepository.findById(jobId)
                .orElseThrow(() -> new ValidationException("Job not found: " + jobId));
        JobMonitor monitor = monitors.get(job.jobType());
        if (monitor == null) {
            throw new ValidationException("No monitor registered for " + job.jobType() + " jobs");
        }
        return monitor.pollJobOnce(jobId);
    }

    // an exception escaping a scheduled task would cancel all later runs
    private void runCycleSafely() {
        try {
            runCycle();
        } catch (Exception e) {
            lastError = e.getMessage();
            log.error("Monitor cycle error", e);
        }
    }
}
