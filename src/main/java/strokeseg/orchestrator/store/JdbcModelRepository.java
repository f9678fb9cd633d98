package strokeseg.orchestrator.store;

import strokeseg.orchestrator.model.Model;
import strokeseg.orchestrator.repository.ModelRepository;
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
 * JDBC implementation of ModelRepository.
 * The UNIQUE constraint on training_id rejects a second model for the same training.
 */
public class JdbcModelRepository implements ModelRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcModelRepository.class);

    private final Database db;

    public JdbcModelRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Model model) {
        db.inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO model (id, training_id, model_name, model_path, created_at) VALUES (?, ?, ?, ?, ?)")) {
                ps.setString(1, model.id());
                ps.setString(2, model.trainingId());
                ps.setString(3, model.modelName());
                ps.setString(4, model.modelPath());
                ps.setTimestamp(5, ts(model.createdAt() != null ? model.createdAt() : Instant.now()));
                ps.executeUpdate();
            }
            log.debug("Saved model: {} for training {}", model.id(), model.trainingId());
            return null;
        });
    }

    @Override
    public Optional<Model> findById(String modelId) {
        return findOne("SELECT * FROM model WHERE id = ?", modelId);
    }

    @Override
    public Optional<Model> findByTrainingId(String trainingId) {
        return findOne("SELECT * FROM model WHERE training_id = ?", trainingId);
    }

    @Override
    public Optional<Model> findByName(String modelName) {
        return findOne("SELECT * FROM model WHERE model_name = ? ORDER BY created_at DESC LIMIT 1", modelName);
    }

    private Optional<Model> findOne(String sql, String key) {
        return db.inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, key);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(mapRow(rs)) : Optional.<Model>empty();
                }
            }
        });
    }

    private Model mapRow(ResultSet rs) throws SQLException {
        return new Model(
                rs.getString("id"),
                rs.getString("training_id"),
                rs.getString("model_name"),
                rs.getString("model_path"),
                toInstant(rs.getTimestamp("created_at")));
    }
}
