package strokeseg.orchestrator.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the {@code Key=Value} listing printed by {@code scontrol show job}.
 * Values may contain spaces; a value ends where the next {@code Key=} begins.
 */
public class ScontrolParser {

    private static final Logger log = LoggerFactory.getLogger(ScontrolParser.class);

    private static final Pattern KEY = Pattern.compile("(?:^|\\s)([A-Za-z][A-Za-z0-9_:/]*)=");
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");
    private static final Set<String> NO_VALUE = Set.of("Unknown", "N/A", "(null)", "None");

    private final ZoneId zone;

    public ScontrolParser() {
        this(ZoneId.systemDefault());
    }

    /**
     * @param zone zone of the cluster clock, scontrol prints local timestamps
     */
    public ScontrolParser(ZoneId zone) {
        this.zone = zone;
    }

    /**
     * All key/value pairs of the output. Later keys win over earlier duplicates.
     */
    public Map<String, String> parse(String output) {
        Map<String, String> fields = new LinkedHashMap<>();
        if (output == null || output.isBlank()) {
            return fields;
        }

        for (String line : output.split("\\R")) {
            Matcher m = KEY.matcher(line);
            String key = null;
            int valueStart = 0;
            while (m.find()) {
                if (key != null) {
                    fields.put(key, line.substring(valueStart, m.start()).trim());
                }
                key = m.group(1);
                valueStart = m.end();
            }
            if (key != null) {
                fields.put(key, line.substring(valueStart).trim());
            }
        }
        return fields;
    }

    /**
     * Build a job observation from scontrol output. A missing {@code JobState} leaves the raw state null.
     */
    public SchedulerJobInfo toJobInfo(String externalId, String output) {
        Map<String, String> fields = parse(output);
        return new SchedulerJobInfo(
                fields.getOrDefault("JobId", externalId),
                blankToNull(fields.get("JobState")),
                parseTimestamp(fields.get("StartTime")),
                parseTimestamp(fields.get("EndTime")),
                blankToNull(fields.get("ExitCode")),
                blankToNull(fields.get("Reason")));
    }

    /**
     * Parse a SLURM timestamp such as {@code 2025-09-13T12:14:02}.
     *
     * @return the instant, or null for placeholders like "Unknown" and unparsable text
     */
    public Instant parseTimestamp(String value) {
        if (value == null || value.isBlank() || NO_VALUE.contains(value)) {
            return null;
        }
        try {
            return LocalDateTime.parse(value, TIMESTAMP).atZone(zone).toInstant();
        } catch (DateTimeParseException e) {
            log.warn("Failed to parse scheduler timestamp: {}", value);
            return null;
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
