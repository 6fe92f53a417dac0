package tgp.scheduler.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import tgp.scheduler.config.SchedulerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Connection pool and schema for job records. Connections come out of the
 * pool with auto-commit off; callers commit explicitly.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(SchedulerConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(1);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("tgp-db-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);
        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Borrow a connection. Caller closes it.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS jobs (
                            id                VARCHAR(128) PRIMARY KEY,
                            type              VARCHAR(32) NOT NULL,
                            cpu_cores         INT NOT NULL,
                            memory_gb         INT NOT NULL,
                            gpu_count         INT NOT NULL DEFAULT 0,
                            max_latency_ms    BIGINT NOT NULL,
                            budget_usd        DOUBLE,
                            deadline          TIMESTAMP,
                            duration_hours    DOUBLE NOT NULL,
                            data_gb           DOUBLE NOT NULL DEFAULT 0,
                            preferred_zone    VARCHAR(128),
                            image             VARCHAR(512) NOT NULL,
                            command           VARCHAR(2048),
                            submitted_at      TIMESTAMP NOT NULL,
                            pending_since     TIMESTAMP NOT NULL,
                            status            VARCHAR(20) NOT NULL DEFAULT 'PENDING',
                            assigned_node     VARCHAR(128),
                            compute_usd       DOUBLE,
                            data_usd          DOUBLE,
                            idle_usd          DOUBLE,
                            total_usd         DOUBLE,
                            latency_ms        BIGINT,
                            reservation_epoch BIGINT NOT NULL DEFAULT 0,
                            requeue_count     INT NOT NULL DEFAULT 0,
                            failure_reason    VARCHAR(32),
                            error_message     VARCHAR(2048),
                            exit_code         INT,
                            output            CLOB,
                            scheduled_at      TIMESTAMP,
                            started_at        TIMESTAMP,
                            ended_at          TIMESTAMP
                        );
                    """);

            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_status ON jobs(status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_status_pending ON jobs(status, pending_since);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_node_status ON jobs(assigned_node, status);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (!dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
