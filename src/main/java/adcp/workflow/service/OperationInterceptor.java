package adcp.workflow.service;

import adcp.workflow.adapter.AdServerAdapter;
import adcp.workflow.adapter.AdapterException;
import adcp.workflow.delivery.DeliveryTarget;
import adcp.workflow.delivery.DeliveryTracking;
import adcp.workflow.model.ErrorCode;
import adcp.workflow.model.Task;
import adcp.workflow.model.TenantPolicy;
import adcp.workflow.operation.ActionDetails;
import adcp.workflow.operation.ActionDetailsBuilders;
import adcp.workflow.operation.CreateMediaBuyOperation;
import adcp.workflow.operation.ExecutionResult;
import adcp.workflow.operation.Operation;
import adcp.workflow.operation.OperationExecutor;
import adcp.workflow.scheduler.BackgroundPollerSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Entry point for every incoming operation. Executes it at once when the tenant does
 * not require review for its kind, otherwise persists it as a pending approval task.
 */
public class OperationInterceptor {

    private static final Logger log = LoggerFactory.getLogger(OperationInterceptor.class);

    private final PolicyResolver policyResolver;
    private final TaskFactory taskFactory;
    private final OperationExecutor executor;
    private final ExecutionLocks locks;
    private final BackgroundPollerSupervisor supervisor;
    private final DeliveryTracking deliveryTracking;
    private final Duration pollInterval;
    private final Duration maxPolling;

    public OperationInterceptor(PolicyResolver policyResolver, TaskFactory taskFactory, OperationExecutor executor,
            ExecutionLocks locks, BackgroundPollerSupervisor supervisor, DeliveryTracking deliveryTracking,
            Duration pollInterval, Duration maxPolling) {
        this.policyResolver = policyResolver;
        this.taskFactory = taskFactory;
        this.executor = executor;
        this.locks = locks;
        this.supervisor = supervisor;
        this.deliveryTracking = deliveryTracking;
        this.pollInterval = pollInterval;
        this.maxPolling = maxPolling;
    }

    public InterceptResult intercept(String tenantId, String principalId, Operation operation) {
        TenantPolicy policy;
        try {
            policy = policyResolver.policyFor(tenantId);
        } catch (PolicyLookupException e) {
            log.warn("Rejecting operation for tenant {}: {}", tenantId, e.getMessage());
            return InterceptResult.rejected(ErrorCode.POLICY_LOOKUP_FAILURE, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Policy lookup for tenant {} failed", tenantId, e);
            return InterceptResult.failed(ErrorCode.INTERNAL_ERROR, "policy storage error: " + e.getMessage());
        }
        return intercept(principalId, operation, policy);
    }

    public InterceptResult intercept(String principalId, Operation operation, TenantPolicy policy) {
        if (operation == null) {
            return InterceptResult.rejected(ErrorCode.INVALID_REQUEST, "operation is required");
        }

        AdServerAdapter adapter;
        try {
            adapter = policyResolver.adapterFor(policy);
        } catch (PolicyLookupException e) {
            log.warn("Rejecting {} for tenant {}: {}", operation.kind().toolName(), policy.tenantId(),
                    e.getMessage());
            return InterceptResult.rejected(ErrorCode.POLICY_LOOKUP_FAILURE, e.getMessage());
        }

        try {
            operation.validate();
        } catch (IllegalArgumentException e) {
            log.info("Invalid {} from {}: {}", operation.kind().toolName(), principalId, e.getMessage());
            return InterceptResult.rejected(ErrorCode.INVALID_REQUEST, e.getMessage());
        }

        if (!policy.requiresApproval(operation.kind())) {
            return executeNow(policy, principalId, operation, adapter);
        }

        ActionDetails details = ActionDetailsBuilders.forOperation(operation, adapter.platformName());
        Task task;
        try {
            task = taskFactory.createApprovalTask(policy.tenantId(), principalId, operation, details);
        } catch (RuntimeException e) {
            log.error("Could not persist {} approval task for tenant {}", operation.kind().toolName(),
                    policy.tenantId(), e);
            return InterceptResult.failed(ErrorCode.INTERNAL_ERROR, "task storage error: " + e.getMessage());
        }
        return InterceptResult.deferred(task.id());
    }

    private InterceptResult executeNow(TenantPolicy policy, String principalId, Operation operation,
            AdServerAdapter adapter) {
        String lockKey = operation.mediaBuyId() != null
                ? ExecutionLocks.mediaBuyKey(operation.mediaBuyId())
                : "op:" + principalId + ":" + operation.kind().toolName();

        ExecutionResult result;
        try {
            result = locks.withLock(lockKey, () -> executor.execute(adapter, operation));
        } catch (AdapterException e) {
            log.warn("{} failed on {} for tenant {}: {}", operation.kind().toolName(), adapter.name(),
                    policy.tenantId(), e.getMessage());
            ErrorCode code = e.isTransient() ? ErrorCode.ADAPTER_TRANSIENT : ErrorCode.ADAPTER_PERMANENT;
            return InterceptResult.failed(code, e.getMessage());
        } catch (RuntimeException e) {
            log.error("{} failed unexpectedly on {}", operation.kind().toolName(), adapter.name(), e);
            return InterceptResult.failed(ErrorCode.ADAPTER_PERMANENT, "internal adapter error: " + e.getMessage());
        }

        log.info("{} executed immediately for tenant {}: {}", operation.kind().toolName(), policy.tenantId(),
                result.summary());

        if (result.pending()) {
            if (result.mediaBuyId() == null) {
                return InterceptResult.failed(ErrorCode.ADAPTER_PERMANENT,
                        "adapter reported pending without a media buy id, cannot poll");
            }
            Task background;
            try {
                background = startPolling(policy, principalId, operation, adapter, result.mediaBuyId());
            } catch (RuntimeException e) {
                // platform call already made, name the media buy
                log.error("{} executed as {} but its polling task could not be stored", operation.kind().toolName(),
                        result.mediaBuyId(), e);
                return InterceptResult.failed(ErrorCode.INTERNAL_ERROR, "media buy " + result.mediaBuyId()
                        + " is pending on the platform but its polling task could not be stored: " + e.getMessage());
            }
            return InterceptResult.executedPending(result, background.id());
        }
        if (!result.status().isSuccess()) {
            return InterceptResult.failed(ErrorCode.ADAPTER_PERMANENT, "platform reported " + result.summary());
        }

        if (operation instanceof CreateMediaBuyOperation create && result.mediaBuyId() != null) {
            deliveryTracking.start(adapter, DeliveryTarget.of(result.mediaBuyId(), policy.tenantId(), create));
        }
        return InterceptResult.executed(result);
    }

    /**
     * No approval task exists on this path, so the background task has no parent.
     */
    private Task startPolling(TenantPolicy policy, String principalId, Operation operation, AdServerAdapter adapter,
            String mediaBuyId) {
        ActionDetails details = ActionDetailsBuilders.backgroundPolling(mediaBuyId, operation, adapter.platformName(),
                pollInterval, maxPolling);
        Task background = taskFactory.createBackgroundTask(policy.tenantId(), principalId, null, operation,
                mediaBuyId, details, maxPolling);
        supervisor.spawn(background);
        return background;
    }
}
