package adcp.workflow.model;

import adcp.workflow.operation.OperationKind;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Per-tenant approval policy.
 *
 * @param tenantId                   tenant identifier
 * @param manualApprovalRequired     master switch for human review
 * @param approvalRequiredOperations operation kinds that need review when the switch is on
 * @param adServer                   name of the adapter serving this tenant
 */
public record TenantPolicy(
        String tenantId,
        boolean manualApprovalRequired,
        Set<OperationKind> approvalRequiredOperations,
        String adServer) {

    public TenantPolicy {
        Objects.requireNonNull(tenantId, "tenantId is required");
        approvalRequiredOperations = approvalRequiredOperations == null || approvalRequiredOperations.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(approvalRequiredOperations));
        adServer = adServer == null || adServer.isBlank() ? "mock" : adServer;
    }

    /** Policy requiring review for every operation kind. */
    public static TenantPolicy reviewAll(String tenantId, String adServer) {
        return new TenantPolicy(tenantId, true, EnumSet.allOf(OperationKind.class), adServer);
    }

    public static TenantPolicy autoApprove(String tenantId, String adServer) {
        return new TenantPolicy(tenantId, false, Set.of(), adServer);
    }

    public boolean requiresApproval(OperationKind kind) {
        return manualApprovalRequired && approvalRequiredOperations.contains(kind);
    }
}
