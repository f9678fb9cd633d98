package strokeseg.orchestrator.monitor;

import java.time.Instant;

/**
 * Snapshot of the monitor loop for health checks.
 *
 * @param running       whether the loop is scheduled
 * @param lastCycleTime end of the last completed cycle, null before the first one
 * @param cycles        completed cycles since start
 * @param lastError     error of the last cycle, null if it ran clean
 */
public record MonitorHealth(boolean running, Instant lastCycleTime, long cycles, String lastError) {
}
