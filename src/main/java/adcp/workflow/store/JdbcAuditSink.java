package adcp.workflow.store;

import adcp.workflow.audit.AuditEntry;
import adcp.workflow.audit.AuditSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;

/**
 * Audit sink writing the audit_log table. Insert-only.
 */
public class JdbcAuditSink implements AuditSink {

    private static final Logger log = LoggerFactory.getLogger(JdbcAuditSink.class);

    private final Database db;

    public JdbcAuditSink(Database db) {
        this.db = db;
    }

    @Override
    public void record(AuditEntry entry) {
        String sql = """
                    INSERT INTO audit_log (id, tenant_id, task_id, event, actor, detail, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, entry.id());
            ps.setString(2, entry.tenantId());
            ps.setString(3, entry.taskId());
            ps.setString(4, entry.event());
            ps.setString(5, entry.actor());
            ps.setString(6, entry.detail());
            ps.setTimestamp(7, Timestamp.from(entry.createdAt()));

            ps.executeUpdate();
            conn.commit();

            log.debug("Audit {} task={} actor={}", entry.event(), entry.taskId(), entry.actor());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record audit entry " + entry.event() + " for " + entry.taskId(), e);
        }
    }

    @Override
    public List<AuditEntry> findByTaskId(String taskId) {
        String sql = "SELECT * FROM audit_log WHERE task_id = ? ORDER BY created_at, id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            List<AuditEntry> entries = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    entries.add(new AuditEntry(
                            rs.getString("id"),
                            rs.getString("tenant_id"),
                            rs.getString("task_id"),
                            rs.getString("event"),
                            rs.getString("actor"),
                            rs.getString("detail"),
                            rs.getTimestamp("created_at").toInstant()));
                }
            }
            return entries;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read audit log for task: " + taskId, e);
        }
    }
}
