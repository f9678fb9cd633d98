package strokeseg.orchestrator.store;

import strokeseg.orchestrator.model.Evaluation;
import strokeseg.orchestrator.model.EvaluationStatus;
import strokeseg.orchestrator.repository.EvaluationRepository;
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
 * JDBC implementation of EvaluationRepository.
 */
public class JdbcEvaluationRepository implements EvaluationRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcEvaluationRepository.class);

    private final Database db;

    public JdbcEvaluationRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Evaluation evaluation) {
        String sql = """
                    INSERT INTO evaluation (id, model_id, job_id, evaluation_path, output_path, configurations, status,
                                            results, error_message, start_time, end_time, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        db.inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, evaluation.id());
                ps.setString(2, evaluation.modelId());
                ps.setString(3, evaluation.jobId());
                ps.setString(4, evaluation.evaluationPath());
                ps.setString(5, evaluation.outputPath());
                ps.setString(6, evaluation.configurations());
                ps.setString(7, evaluation.status().name());
                ps.setString(8, evaluation.results());
                ps.setString(9, evaluation.errorMessage());
                ps.setTimestamp(10, ts(evaluation.startTime()));
                ps.setTimestamp(11, ts(evaluation.endTime()));
                ps.setTimestamp(12, ts(evaluation.createdAt() != null ? evaluation.createdAt() : Instant.now()));
                ps.executeUpdate();
            }
            log.debug("Saved evaluation: {} (model {})", evaluation.id(), evaluation.modelId());
            return null;
        });
    }

    @Override
    public Optional<Evaluation> findById(String evaluationId) {
        return findOne("SELECT * FROM evaluation WHERE id = ?", evaluationId);
    }

    @Override
    public Optional<Evaluation> findByJobId(String jobId) {
        return findOne("SELECT * FROM evaluation WHERE job_id = ?", jobId);
    }

    @Override
    public boolean markEvaluating(String evaluationId, Instant startTime) {
        return db.inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement("""
                        UPDATE evaluation SET status = 'EVALUATING', start_time = COALESCE(start_time, ?)
                        WHERE id = ? AND status = 'PENDING'
                    """)) {
                ps.setTimestamp(1, ts(startTime));
                ps.setString(2, evaluationId);
                return ps.executeUpdate() > 0;
            }
        });
    }

    @Override
    public boolean markCompleted(String evaluationId, String results, Instant endTime) {
        return db.inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement("""
                        UPDATE evaluation SET status = 'COMPLETED', results = ?, end_time = ?
                        WHERE id = ? AND status IN ('PENDING', 'EVALUATING')
                    """)) {
                ps.setString(1, results);
                ps.setTimestamp(2, ts(endTime));
                ps.setString(3, evaluationId);
                return ps.executeUpdate() > 0;
            }
        });
    }

    @Override
    public boolean markFailed(String evaluationId, String errorMessage, Instant endTime) {
        return db.inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement("""
                        UPDATE evaluation SET status = 'FAILED', error_message = ?, end_time = ?
                        WHERE id = ? AND status IN ('PENDING', 'EVALUATING')
                    """)) {
                ps.setString(1, errorMessage);
                ps.setTimestamp(2, ts(endTime));
                ps.setString(3, evaluationId);
                return ps.executeUpdate() > 0;
            }
        });
    }

    private Optional<Evaluation> findOne(String sql, String key) {
        return db.inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, key);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(mapRow(rs)) : Optional.<Evaluation>empty();
                }
            }
        });
    }

    private Evaluation mapRow(ResultSet rs) throws SQLException {
        return new Evaluation(
                rs.getString("id"),
                rs.getString("model_id"),
                rs.getString("job_id"),
                rs.getString("evaluation_path"),
                rs.getString("output_path"),
                rs.getString("configurations"),
                EvaluationStatus.valueOf(rs.getString("status")),
                rs.getString("results"),
                rs.getString("error_message"),
                toInstant(rs.getTimestamp("start_time")),
                toInstant(rs.getTimestamp("end_time")),
                toInstant(rs.getTimestamp("created_at")));
    }
}
