package adcp.workflow.service;

import adcp.workflow.adapter.AdServerAdapter;
import adcp.workflow.adapter.AdapterException;
import adcp.workflow.audit.AuditEntry;
import adcp.workflow.delivery.DeliveryTarget;
import adcp.workflow.delivery.DeliveryTracking;
import adcp.workflow.model.Resolution;
import adcp.workflow.model.Task;
import adcp.workflow.model.TaskStatus;
import adcp.workflow.operation.ActionDetails;
import adcp.workflow.operation.ActionDetailsBuilders;
import adcp.workflow.operation.CreateMediaBuyOperation;
import adcp.workflow.operation.ExecutionResult;
import adcp.workflow.operation.Operation;
import adcp.workflow.operation.OperationExecutor;
import adcp.workflow.operation.RequestContextCodec;
import adcp.workflow.repository.TaskRepository;
import adcp.workflow.scheduler.BackgroundPollerSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Runs the stored operation of an approved task, exactly once.
 * <p>
 * The repository's guarded resolve lets only one caller move a task to WORKING; this class
 * additionally holds the media buy lock for the adapter call and re-checks the status inside it.
 */
public class DeferredExecutionResumer {

    private static final Logger log = LoggerFactory.getLogger(DeferredExecutionResumer.class);

    private final TaskRepository tasks;
    private final TaskFactory taskFactory;
    private final PolicyResolver policyResolver;
    private final RequestContextCodec codec;
    private final OperationExecutor executor;
    private final ExecutionLocks locks;
    private final BackgroundPollerSupervisor supervisor;
    private final DeliveryTracking deliveryTracking;
    private final Clock clock;
    private final Duration pollInterval;
    private final Duration maxPolling;

    public DeferredExecutionResumer(TaskRepository tasks, TaskFactory taskFactory, PolicyResolver policyResolver,
            RequestContextCodec codec, OperationExecutor executor, ExecutionLocks locks,
            BackgroundPollerSupervisor supervisor, DeliveryTracking deliveryTracking, Clock clock,
            Duration pollInterval, Duration maxPolling) {
        this.tasks = tasks;
        this.taskFactory = taskFactory;
        this.policyResolver = policyResolver;
        this.codec = codec;
        this.executor = executor;
        this.locks = locks;
        this.supervisor = supervisor;
        this.deliveryTracking = deliveryTracking;
        this.clock = clock;
        this.pollInterval = pollInterval;
        this.maxPolling = maxPolling;
    }

    /**
     * React to a task that was just resolved by a reviewer.
     *
     * @param task the task as stored after resolution
     */
    public ExecutionOutcome onTaskResolved(Task task) {
        if (task.resolution() == Resolution.REJECTED) {
            taskFactory.audit(task, AuditEntry.TASK_REJECTED, task.resolvedBy(), task.resolutionDetail());
            taskFactory.notifyResolved(task.id());
            log.info("Task {} rejected by {}", task.id(), task.resolvedBy());
            return ExecutionOutcome.REJECTED;
        }
        if (task.isBackground() || task.resolution() != Resolution.APPROVED
                || task.status() != TaskStatus.WORKING) {
            log.debug("Nothing to execute for task {} ({}, {})", task.id(), task.status(), task.resolution());
            return ExecutionOutcome.SKIPPED;
        }

        Operation operation;
        AdServerAdapter adapter;
        try {
            operation = codec.decodeOperation(task.requestContext(), task.toolName());
            adapter = policyResolver.adapterFor(task.tenantId());
        } catch (IllegalStateException | PolicyLookupException e) {
            log.error("Cannot execute task {}: {}", task.id(), e.getMessage());
            return fail(task, e.getMessage());
        }

        return locks.withLock(ExecutionLocks.keyFor(task), () -> executeLocked(task.id(), operation, adapter));
    }

    private ExecutionOutcome executeLocked(String taskId, Operation operation, AdServerAdapter adapter) {
        Optional<Task> current = tasks.findById(taskId);
        if (current.isEmpty() || current.get().status() != TaskStatus.WORKING) {
            log.info("Task {} no longer WORKING, not executing", taskId);
            return ExecutionOutcome.SKIPPED;
        }
        Task task = current.get();

        ExecutionResult result;
        try {
            result = executor.execute(adapter, operation);
        } catch (AdapterException e) {
            log.warn("Task {} failed on {}: {}", task.id(), adapter.name(), e.getMessage());
            return fail(task, e.detail());
        } catch (RuntimeException e) {
            log.error("Task {} failed unexpectedly on {}", task.id(), adapter.name(), e);
            return fail(task, "internal adapter error: " + e.getMessage());
        }

        if (result.mediaBuyId() != null) {
            tasks.assignMediaBuy(task.id(), result.mediaBuyId());
        }

        if (result.pending()) {
            if (result.mediaBuyId() == null) {
                return fail(task, "adapter reported pending without a media buy id, cannot poll");
            }
            ActionDetails details = ActionDetailsBuilders.backgroundPolling(result.mediaBuyId(), operation,
                    adapter.platformName(), pollInterval, maxPolling);
            Task background = taskFactory.createBackgroundTask(task.tenantId(), task.principalId(), task.id(),
                    operation, result.mediaBuyId(), details, maxPolling);
            supervisor.spawn(background);
            log.info("Task {} pending on platform, polling via {}", task.id(), background.id());
            return ExecutionOutcome.DEFERRED_TO_BACKGROUND;
        }

        if (!result.status().isSuccess()) {
            return fail(task, "platform reported " + result.summary());
        }

        if (!tasks.transition(task.id(), TaskStatus.WORKING, TaskStatus.COMPLETED, result.summary(),
                clock.instant())) {
            log.warn("Task {} changed state while executing, result {} not recorded", task.id(), result.summary());
            return ExecutionOutcome.SKIPPED;
        }
        taskFactory.audit(task, AuditEntry.TASK_EXECUTED, TaskFactory.SYSTEM_ACTOR, result.summary());
        taskFactory.notifyResolved(task.id());
        log.info("Task {} executed: {}", task.id(), result.summary());

        if (operation instanceof CreateMediaBuyOperation create && result.mediaBuyId() != null) {
            deliveryTracking.start(adapter, DeliveryTarget.of(result.mediaBuyId(), task.tenantId(), create));
        }
        return ExecutionOutcome.COMPLETED;
    }

    private ExecutionOutcome fail(Task task, String detail) {
        if (!tasks.transition(task.id(), TaskStatus.WORKING, TaskStatus.FAILED, detail, clock.instant())) {
            return ExecutionOutcome.SKIPPED;
        }
        taskFactory.audit(task, AuditEntry.TASK_EXECUTION_FAILED, TaskFactory.SYSTEM_ACTOR, detail);
        taskFactory.notifyResolved(task.id());
        return ExecutionOutcome.FAILED;
    }
}
