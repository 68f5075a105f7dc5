package adcp.workflow.repository;

import adcp.workflow.model.TenantPolicy;

import java.util.Optional;

/**
 * Tenant approval policies.
 */
public interface TenantPolicyRepository {

    Optional<TenantPolicy> findByTenantId(String tenantId);

    /**
     * Insert or replace the policy for its tenant.
     */
    void save(TenantPolicy policy);
}
