package adcp.workflow.service;

import adcp.workflow.adapter.AdServerAdapter;
import adcp.workflow.adapter.AdapterRegistry;
import adcp.workflow.model.TenantPolicy;
import adcp.workflow.repository.TenantPolicyRepository;

/**
 * Looks up a tenant's policy and the adapter it names.
 */
public class PolicyResolver {

    private final TenantPolicyRepository policies;
    private final AdapterRegistry adapters;

    public PolicyResolver(TenantPolicyRepository policies, AdapterRegistry adapters) {
        this.policies = policies;
        this.adapters = adapters;
    }

    public TenantPolicy policyFor(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new PolicyLookupException("tenant_id is required");
        }
        return policies.findByTenantId(tenantId)
                .orElseThrow(() -> new PolicyLookupException("no policy configured for tenant " + tenantId));
    }

    public AdServerAdapter adapterFor(TenantPolicy policy) {
        return adapters.find(policy.adServer())
                .orElseThrow(() -> new PolicyLookupException(
                        "ad server '" + policy.adServer() + "' for tenant " + policy.tenantId() + " is not registered"));
    }

    public AdServerAdapter adapterFor(String tenantId) {
        return adapterFor(policyFor(tenantId));
    }
}
