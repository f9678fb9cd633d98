package strokeseg.orchestrator.store;

import strokeseg.orchestrator.model.Training;
import strokeseg.orchestrator.model.TrainingStatus;
import strokeseg.orchestrator.repository.TrainingRepository;
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
 * JDBC implementation of TrainingRepository.
 */
public class JdbcTrainingRepository implements TrainingRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTrainingRepository.class);

    private final Database db;

    public JdbcTrainingRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Training training) {
        String sql = """
                    INSERT INTO training (id, name, images_path, labels_path, model_path, configuration, fold_index,
                                          job_id, status, error_message, start_time, end_time, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        db.inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, training.id());
                ps.setString(2, training.name());
                ps.setString(3, training.imagesPath());
                ps.setString(4, training.labelsPath());
                ps.setString(5, training.modelPath());
                ps.setString(6, training.configuration());
                ps.setInt(7, training.foldIndex());
                ps.setString(8, training.jobId());
                ps.setString(9, training.status().name());
                ps.setString(10, training.errorMessage());
                ps.setTimestamp(11, ts(training.startTime()));
                ps.setTimestamp(12, ts(training.endTime()));
                ps.setTimestamp(13, ts(training.createdAt() != null ? training.createdAt() : Instant.now()));
                ps.executeUpdate();
            }
            log.debug("Saved training: {} ({})", training.id(), training.name());
            return null;
        });
    }

    @Override
    public Optional<Training> findById(String trainingId) {
        return findOne("SELECT * FROM training WHERE id = ?", trainingId);
    }

    @Override
    public Optional<Training> findByJobId(String jobId) {
        return findOne("SELECT * FROM training WHERE job_id = ?", jobId);
    }

    @Override
    public boolean markTrained(String trainingId, Instant endTime) {
        return db.inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "UPDATE training SET status = 'TRAINED', end_time = ? WHERE id = ? AND status = 'TRAINING'")) {
                ps.setTimestamp(1, ts(endTime));
                ps.setString(2, trainingId);
                return ps.executeUpdate() > 0;
            }
        });
    }

    @Override
    public boolean markFailed(String trainingId, String errorMessage, Instant endTime) {
        return db.inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement("""
                        UPDATE training SET status = 'FAILED', error_message = ?, end_time = ?
                        WHERE id = ? AND status = 'TRAINING'
                    """)) {
                ps.setString(1, errorMessage);
                ps.setTimestamp(2, ts(endTime));
                ps.setString(3, trainingId);
                return ps.executeUpdate() > 0;
            }
        });
    }

    private Optional<Training> findOne(String sql, String key) {
        return db.inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, key);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(mapRow(rs)) : Optional.<Training>empty();
                }
            }
        });
    }

    private Training mapRow(ResultSet rs) throws SQLException {
        return new Training(
                rs.getString("id"),
                rs.getString("name"),
                rs.getString("images_path"),
                rs.getString("labels_path"),
                rs.getString("model_path"),
                rs.getString("configuration"),
                rs.getInt("fold_index"),
                rs.getString("job_id"),
                TrainingStatus.valueOf(rs.getString("status")),
                rs.getString("error_message"),
                toInstant(rs.getTimestamp("start_time")),
                toInstant(rs.getTimestamp("end_time")),
                toInstant(rs.getTimestamp("created_at")));
    }
}
