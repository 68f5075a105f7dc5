package adcp.workflow.store;

import adcp.workflow.model.TenantPolicy;
import adcp.workflow.operation.OperationKind;
import adcp.workflow.repository.TenantPolicyRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * JDBC implementation of TenantPolicyRepository.
 * Approval-required operations are stored as a comma-separated list of tool names.
 */
public class JdbcTenantPolicyRepository implements TenantPolicyRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTenantPolicyRepository.class);

    private final Database db;

    public JdbcTenantPolicyRepository(Database db) {
        this.db = db;
    }

    @Override
    public Optional<TenantPolicy> findByTenantId(String tenantId) {
        String sql = "SELECT * FROM tenant_policies WHERE tenant_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, tenantId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new TenantPolicy(
                            rs.getString("tenant_id"),
                            rs.getBoolean("manual_approval_required"),
                            parseOperations(rs.getString("approval_required_operations")),
                            rs.getString("ad_server")));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find tenant policy: " + tenantId, e);
        }
    }

    @Override
    public void save(TenantPolicy policy) {
        String updateSql = """
                    UPDATE tenant_policies
                    SET manual_approval_required = ?, approval_required_operations = ?, ad_server = ?, updated_at = ?
                    WHERE tenant_id = ?
                """;
        String insertSql = """
                    INSERT INTO tenant_policies (tenant_id, manual_approval_required, approval_required_operations,
                                                 ad_server, updated_at)
                    VALUES (?, ?, ?, ?, ?)
                """;

        String operations = formatOperations(policy.approvalRequiredOperations());
        Timestamp now = Timestamp.from(Instant.now());

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement update = conn.prepareStatement(updateSql)) {
                update.setBoolean(1, policy.manualApprovalRequired());
                update.setString(2, operations);
                update.setString(3, policy.adServer());
                update.setTimestamp(4, now);
                update.setString(5, policy.tenantId());

                if (update.executeUpdate() == 0) {
                    try (PreparedStatement insert = conn.prepareStatement(insertSql)) {
                        insert.setString(1, policy.tenantId());
                        insert.setBoolean(2, policy.manualApprovalRequired());
                        insert.setString(3, operations);
                        insert.setString(4, policy.adServer());
                        insert.setTimestamp(5, now);
                        insert.executeUpdate();
                    }
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
            log.info("Tenant policy saved: {} (manual approval {}, operations [{}], ad server {})",
                    policy.tenantId(), policy.manualApprovalRequired(), operations, policy.adServer());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save tenant policy: " + policy.tenantId(), e);
        }
    }

    private static String formatOperations(Set<OperationKind> kinds) {
        return kinds.stream()
                .map(OperationKind::toolName)
                .sorted()
                .collect(Collectors.joining(","));
    }

    private static Set<OperationKind> parseOperations(String csv) {
        Set<OperationKind> kinds = EnumSet.noneOf(OperationKind.class);
        if (csv == null || csv.isBlank()) {
            return kinds;
        }
        for (String part : csv.split(",")) {
            String toolName = part.trim();
            if (toolName.isEmpty()) {
                continue;
            }
            try {
                kinds.add(OperationKind.fromToolName(toolName));
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring unknown operation in tenant policy: {}", toolName);
            }
        }
        return kinds;
    }
}
