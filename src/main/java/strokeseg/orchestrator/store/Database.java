package strokeseg.orchestrator.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import strokeseg.orchestrator.config.OrchestratorConfig;
import strokeseg.orchestrator.exception.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool, schema management and scoped transactions.
 * Uses HikariCP for connection pooling.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    /** Connection of the transaction running on the current thread, if any. */
    private final ThreadLocal<Connection> current = new ThreadLocal<>();

    private final HikariDataSource dataSource;

    /**
     * Unit of work executed against a pooled connection.
     */
    @FunctionalInterface
    public interface SqlWork<T> {
        T apply(Connection conn) throws SQLException;
    }

    public Database(OrchestratorConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(Math.min(2, poolSize));
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("strokeseg-db-pool");
        hikariConfig.setAutoCommit(false);

        // H2 specific settings
        if (jdbcUrl.contains("h2:")) {
            hikariConfig.addDataSourceProperty("MODE", "PostgreSQL");
        }

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        // Initialize schema
        initSchema();
    }

    /**
     * Run {@code work} in a transaction.
     * Joins the transaction already open on this thread; otherwise acquires a connection,
     * commits on success, rolls back on any exception and always releases the connection.
     */
    public <T> T inTransaction(SqlWork<T> work) {
        Connection outer = current.get();
        if (outer != null) {
            try {
                return work.apply(outer);
            } catch (SQLException e) {
                throw new PersistenceException("Database operation failed: " + e.getMessage(), e);
            }
        }

        try (Connection conn = dataSource.getConnection()) {
            current.set(conn);
            try {
                T result = work.apply(conn);
                conn.commit();
                return result;
            } catch (SQLException e) {
                rollbackQuietly(conn, e);
                throw new PersistenceException("Database operation failed: " + e.getMessage(), e);
            } catch (RuntimeException | Error e) {
                rollbackQuietly(conn, e);
                throw e;
            } finally {
                current.remove();
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to acquire database connection: " + e.getMessage(), e);
        }
    }

    /**
     * Run {@code work} in a transaction without a result.
     */
    public void inTransaction(Runnable work) {
        inTransaction(conn -> {
            work.run();
            return null;
        });
    }

    /**
     * Get the underlying DataSource (for frameworks that need it).
     */
    public DataSource getDataSource() {
        return dataSource;
    }

    /**
     * Check if database is healthy.
     */
    public boolean isHealthy() {
        try (Connection conn = dataSource.getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private static void rollbackQuietly(Connection conn, Throwable cause) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
            log.warn("Rollback failed: {}", e.getMessage());
        }
    }

    /**
     * Initialize database schema.
     */
    private void initSchema() {
        try (Connection conn = dataSource.getConnection();
                Statement st = conn.createStatement()) {

            // ---------- JOBS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS jobs (
                            id                   VARCHAR(36) PRIMARY KEY,
                            external_id          VARCHAR(255),
                            job_type             VARCHAR(20) NOT NULL,
                            status               VARCHAR(20) NOT NULL DEFAULT 'PENDING',
                            start_time           TIMESTAMP,
                            end_time             TIMESTAMP,
                            error_message        CLOB,
                            submission_artifact  CLOB NOT NULL,
                            unknown_observations INT NOT NULL DEFAULT 0,
                            created_at           TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            updated_at           TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            CONSTRAINT jobs_status_check CHECK (status IN ('PENDING', 'RUNNING', 'COMPLETED', 'FAILED')),
                            CONSTRAINT jobs_type_check CHECK (job_type IN ('TRAINING', 'INFERENCE', 'EVALUATION'))
                        );
                    """);

            // ---------- TRAINING ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS training (
                            id             VARCHAR(36) PRIMARY KEY,
                            name           VARCHAR(255) NOT NULL,
                            images_path    VARCHAR(1024),
                            labels_path    VARCHAR(1024),
                            model_path     VARCHAR(1024) NOT NULL,
                            configuration  VARCHAR(64) NOT NULL,
                            fold_index     INT NOT NULL DEFAULT 0,
                            job_id         VARCHAR(36) NOT NULL REFERENCES jobs(id),
                            status         VARCHAR(20) NOT NULL,
                            error_message  CLOB,
                            start_time     TIMESTAMP,
                            end_time       TIMESTAMP,
                            created_at     TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            CONSTRAINT training_status_check CHECK (status IN ('TRAINING', 'TRAINED', 'FAILED'))
                        );
                    """);

            // ---------- MODEL ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS model (
                            id           VARCHAR(36) PRIMARY KEY,
                            training_id  VARCHAR(36) NOT NULL REFERENCES training(id),
                            model_name   VARCHAR(255) NOT NULL,
                            model_path   VARCHAR(1024),
                            created_at   TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            CONSTRAINT model_training_unique UNIQUE (training_id)
                        );
                    """);

            // ---------- INFERENCE ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS inference (
                            id             VARCHAR(36) PRIMARY KEY,
                            model_id       VARCHAR(36) NOT NULL REFERENCES model(id),
                            job_id         VARCHAR(36) NOT NULL REFERENCES jobs(id),
                            input_path     VARCHAR(1024) NOT NULL,
                            output_dir     VARCHAR(1024) NOT NULL,
                            prediction     CLOB,
                            status         VARCHAR(20) NOT NULL,
                            error_message  CLOB,
                            start_time     TIMESTAMP,
                            end_time       TIMESTAMP,
                            created_at     TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            CONSTRAINT inference_status_check CHECK (status IN ('PENDING', 'PROCESSING', 'COMPLETED', 'FAILED'))
                        );
                    """);

            // ---------- EVALUATION ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS evaluation (
                            id               VARCHAR(36) PRIMARY KEY,
                            model_id         VARCHAR(36) NOT NULL REFERENCES model(id),
                            job_id           VARCHAR(36) NOT NULL REFERENCES jobs(id),
                            evaluation_path  VARCHAR(1024) NOT NULL,
                            output_path      VARCHAR(1024) NOT NULL,
                            configurations   CLOB NOT NULL,
                            status           VARCHAR(20) NOT NULL,
                            results          CLOB,
                            error_message    CLOB,
                            start_time       TIMESTAMP,
                            end_time         TIMESTAMP,
                            created_at       TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            CONSTRAINT evaluation_status_check CHECK (status IN ('PENDING', 'EVALUATING', 'COMPLETED', 'FAILED'))
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_type_status ON jobs(job_type, status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_training_job ON training(job_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_model_name ON model(model_name);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_inference_job ON inference(job_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_evaluation_job ON evaluation(job_id);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new PersistenceException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
