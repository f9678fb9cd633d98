package strokeseg.orchestrator.store;

import strokeseg.orchestrator.model.Inference;
import strokeseg.orchestrator.model.InferenceStatus;
import strokeseg.orchestrator.repository.InferenceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;

import static strokeseg.orchestrator.store.JdbcSupport.toInstant;
import static strokeseg.orchestrator.store.JdbcSupport.ts;

/**
 * JDBC implementation of InferenceRepository.
 */
public class JdbcInferenceRepository implements InferenceRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcInferenceRepository.class);

    private final Database db;

    public JdbcInferenceRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Inference inference) {
        String sql = """
                    INSERT INTO inference (id, model_id, job_id, input_path, output_dir, prediction, status,
                                           error_message, start_time, end_time, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        db.inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, inference.id());
                ps.setString(2, inference.modelId());
                ps.setString(3, inference.jobId());
                ps.setString(4, inference.inputPath());
                ps.setString(5, inference.outputDir());
                ps.setString(6, inference.prediction());
                ps.setString(7, inference.status().name());
                ps.setString(8, inference.errorMessage());
                ps.setTimestamp(9, ts(inference.startTime()));
                ps.setTimestamp(10, ts(inference.endTime()));
                ps.setTimestamp(11, ts(inference.createdAt() != null ? inference.createdAt() : Instant.now()));
                ps.executeUpdate();
            }
            log.debug("Saved inference: {} (model {})", inference.id(), inference.modelId());
            return null;
        });
    }

    @Override
    public Optional<Inference> findById(String inferenceId) {
        return findOne("SELECT * FROM inference WHERE id = ?", inferenceId);
    }

    @Override
    public Optional<Inference> findByJobId(String jobId) {
        return findOne("SELECT * FROM inference WHERE job_id = ?", jobId);
    }

    @Override
    public boolean markProcessing(String inferenceId, Instant startTime) {
        return db.inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement("""
                        UPDATE inference SET status = 'PROCESSING', start_time = COALESCE(start_time, ?)
                        WHERE id = ? AND status = 'PENDING'
                    """)) {
                ps.setTimestamp(1, ts(startTime));
                ps.setString(2, inferenceId);
                return ps.executeUpdate() > 0;
            }
        });
    }

    @Override
    public boolean markCompleted(String inferenceId, String prediction, Instant endTime) {
        return db.inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement("""
                        UPDATE inference SET status = 'COMPLETED', prediction = ?, end_time = ?
                        WHERE id = ? AND status IN ('PENDING', 'PROCESSING')
                    """)) {
                ps.setString(1, prediction);
                ps.setTimestamp(2, ts(endTime));
                ps.setString(3, inferenceId);
                return ps.executeUpdate() > 0;
            }
        });
    }

    @Override
    public boolean markFailed(String inferenceId, String errorMessage, Instant endTime) {
        return db.inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement("""
                        UPDATE inference SET status = 'FAILED', error_message = ?, end_time = ?
                        WHERE id = ? AND status IN ('PENDING', 'PROCESSING')
                    """)) {
                ps.setString(1, errorMessage);
                ps.setTimestamp(2, ts(endTime));
                ps.setString(3, inferenceId);
                return ps.executeUpdate() > 0;
            }
        });
    }

    private Optional<Inference> findOne(String sql, String key) {
        return db.inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, key);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(mapRow(rs)) : Optional.<Inference>empty();
                }
            }
        });
    }

    private Inference mapRow(ResultSet rs) throws SQLException {
        return new Inference(
                rs.getString("id"),
                rs.getString("model_id"),
                rs.getString("job_id"),
                rs.getString("input_path"),
                rs.getString("output_dir"),
                rs.getString("prediction"),
                InferenceStatus.valueOf(rs.getString("status")),
                rs.getString("error_message"),
                toInstant(rs.getTimestamp("start_time")),
                toInstant(rs.getTimestamp("end_time")),
                toInstant(rs.getTimestamp("created_at")));
    }
}
