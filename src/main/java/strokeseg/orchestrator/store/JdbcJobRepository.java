package strokeseg.orchestrator.store;

import strokeseg.orchestrator.model.Job;
import strokeseg.orchestrator.model.JobStatus;
import strokeseg.orchestrator.model.JobType;
import strokeseg.orchestrator.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static strokeseg.orchestrator.store.JdbcSupport.toInstant;
import static strokeseg.orchestrator.store.JdbcSupport.ts;

/**
 * JDBC implementation of JobRepository.
 */
public class JdbcJobRepository implements JobRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobRepository.class);

    private final Database db;

    public JdbcJobRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Job job) {
        String sql = """
                    INSERT INTO jobs (id, external_id, job_type, status, start_time, end_time, error_message,
                                      submission_artifact, unknown_observations, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        db.inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                Instant now = Instant.now();
                ps.setString(1, job.id());
                ps.setString(2, job.externalId());
                ps.setString(3, job.jobType().name());
                ps.setString(4, job.status().name());
                ps.setTimestamp(5, ts(job.startTime()));
                ps.setTimestamp(6, ts(job.endTime()));
                ps.setString(7, job.errorMessage());
                ps.setString(8, job.submissionArtifact());
                ps.setInt(9, job.unknownObservations());
                ps.setTimestamp(10, ts(job.createdAt() != null ? job.createdAt() : now));
                ps.setTimestamp(11, ts(now));
                ps.executeUpdate();
            }
            log.debug("Saved job: {} ({}, {})", job.id(), job.jobType(), job.status());
            return null;
        });
    }

    @Override
    public Optional<Job> findById(String jobId) {
        return db.inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement("SELECT * FROM jobs WHERE id = ?")) {
                ps.setString(1, jobId);
                return executeQuery(ps).stream().findFirst();
            }
        });
    }

    @Override
    public List<Job> findByStatus(JobStatus status) {
        return db.inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT * FROM jobs WHERE status = ? ORDER BY created_at")) {
                ps.setString(1, status.name());
                return executeQuery(ps);
            }
        });
    }

    @Override
    public List<Job> findMonitorable(JobType jobType) {
        String sql = """
                    SELECT * FROM jobs
                    WHERE job_type = ? AND status IN ('PENDING', 'RUNNING') AND external_id IS NOT NULL
                    ORDER BY created_at
                """;

        return db.inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, jobType.name());
                return executeQuery(ps);
            }
        });
    }

    @Override
    public boolean assignExternalId(String jobId, String externalId) {
        String sql = """
                    UPDATE jobs SET external_id = ?, updated_at = ?
                    WHERE id = ? AND status = 'PENDING' AND external_id IS NULL
                """;

        return db.inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, externalId);
                ps.setTimestamp(2, ts(Instant.now()));
                ps.setString(3, jobId);
                return ps.executeUpdate() > 0;
            }
        });
    }

    @Override
    public boolean markRunning(String jobId, JobStatus expected, Instant startTime) {
        String sql = """
                    UPDATE jobs SET status = 'RUNNING', start_time = COALESCE(start_time, ?),
                                    unknown_observations = 0, updated_at = ?
                    WHERE id = ? AND status = ?
                """;

        return db.inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setTimestamp(1, ts(startTime));
                ps.setTimestamp(2, ts(Instant.now()));
                ps.setString(3, jobId);
                ps.setString(4, expected.name());
                return ps.executeUpdate() > 0;
            }
        });
    }

    @Override
    public boolean markFinished(String jobId, JobStatus expected, JobStatus terminal,
            Instant startTime, Instant endTime, String errorMessage) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminal);
        }

        String sql = """
                    UPDATE jobs SET status = ?, start_time = COALESCE(start_time, ?), end_time = ?,
                                    error_message = ?, unknown_observations = 0, updated_at = ?
                    WHERE id = ? AND status = ?
                """;

        return db.inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, terminal.name());
                ps.setTimestamp(2, ts(startTime));
                ps.setTimestamp(3, ts(endTime != null ? endTime : Instant.now()));
                ps.setString(4, errorMessage);
                ps.setTimestamp(5, ts(Instant.now()));
                ps.setString(6, jobId);
                ps.setString(7, expected.name());
                return ps.executeUpdate() > 0;
            }
        });
    }

    @Override
    public boolean updateUnknownObservations(String jobId, JobStatus expected, int count) {
        String sql = "UPDATE jobs SET unknown_observations = ?, updated_at = ? WHERE id = ? AND status = ?";

        return db.inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setInt(1, count);
                ps.setTimestamp(2, ts(Instant.now()));
                ps.setString(3, jobId);
                ps.setString(4, expected.name());
                return ps.executeUpdate() > 0;
            }
        });
    }

    @Override
    public String generateId() {
        return UUID.randomUUID().toString();
    }

    // --- Helpers ---

    private List<Job> executeQuery(PreparedStatement ps) throws SQLException {
        List<Job> jobs = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                jobs.add(mapRow(rs));
            }
        }
        return jobs;
    }

    private Job mapRow(ResultSet rs) throws SQLException {
        return Job.builder()
                .id(rs.getString("id"))
                .externalId(rs.getString("external_id"))
                .jobType(JobType.valueOf(rs.getString("job_type")))
                .status(JobStatus.valueOf(rs.getString("status")))
                .startTime(toInstant(rs.getTimestamp("start_time")))
                .endTime(toInstant(rs.getTimestamp("end_time")))
                .errorMessage(rs.getString("error_message"))
                .submissionArtifact(rs.getString("submission_artifact"))
                .unknownObservations(rs.getInt("unknown_observations"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .build();
    }
}
