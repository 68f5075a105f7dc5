package adcp.workflow.store;

import adcp.workflow.config.WorkflowConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling; connections are handed out with autoCommit off.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(WorkflowConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("adcp-workflow-db-pool");
        hikariConfig.setAutoCommit(false);

        if (jdbcUrl.contains("h2:")) {
            hikariConfig.addDataSourceProperty("MODE", "PostgreSQL");
        }

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public DataSource getDataSource() {
        return dataSource;
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

            // ---------- TASKS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS tasks (
                            id                VARCHAR(64) PRIMARY KEY,
                            tenant_id         VARCHAR(64) NOT NULL,
                            principal_id      VARCHAR(128),
                            step_type         VARCHAR(20) NOT NULL,
                            tool_name         VARCHAR(64) NOT NULL,
                            status            VARCHAR(20) NOT NULL,
                            owner             VARCHAR(20) NOT NULL,
                            action            VARCHAR(20) NOT NULL,
                            media_buy_id      VARCHAR(64),
                            request_context   CLOB NOT NULL,
                            assigned_to       VARCHAR(128),
                            parent_task_id    VARCHAR(64),
                            created_at        TIMESTAMP NOT NULL,
                            due_at            TIMESTAMP NOT NULL,
                            resolved_at       TIMESTAMP,
                            resolved_by       VARCHAR(128),
                            resolution        VARCHAR(20),
                            resolution_detail VARCHAR(4096),
                            version           BIGINT DEFAULT 0 NOT NULL,
                            CONSTRAINT chk_tasks_due_after_created CHECK (due_at > created_at)
                        );
                    """);

            // ---------- TENANT POLICIES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS tenant_policies (
                            tenant_id                    VARCHAR(64) PRIMARY KEY,
                            manual_approval_required     BOOLEAN NOT NULL,
                            approval_required_operations VARCHAR(512),
                            ad_server                    VARCHAR(64) NOT NULL,
                            updated_at                   TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- AUDIT LOG ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS audit_log (
                            id          VARCHAR(64) PRIMARY KEY,
                            tenant_id   VARCHAR(64),
                            task_id     VARCHAR(64),
                            event       VARCHAR(64) NOT NULL,
                            actor       VARCHAR(128),
                            detail      VARCHAR(4096),
                            created_at  TIMESTAMP NOT NULL
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_tenant_status ON tasks(tenant_id, status, created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_step_status ON tasks(step_type, status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_parent ON tasks(parent_task_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_audit_task ON audit_log(task_id, created_at);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize database schema", e);
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
