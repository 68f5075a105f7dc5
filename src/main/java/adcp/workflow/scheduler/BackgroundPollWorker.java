package adcp.workflow.scheduler;

import adcp.workflow.adapter.AdServerAdapter;
import adcp.workflow.adapter.AdapterException;
import adcp.workflow.adapter.MediaBuyStatus;
import adcp.workflow.audit.AuditEntry;
import adcp.workflow.delivery.DeliveryTarget;
import adcp.workflow.model.Resolution;
import adcp.workflow.model.ResolveOutcome;
import adcp.workflow.model.Task;
import adcp.workflow.model.TaskStatus;
import adcp.workflow.operation.ActionDetailsBuilders;
import adcp.workflow.operation.CreateMediaBuyOperation;
import adcp.workflow.operation.Operation;
import adcp.workflow.operation.UpdateMediaBuyOperation;
import adcp.workflow.service.ExecutionLocks;
import adcp.workflow.service.PolicyLookupException;
import adcp.workflow.service.TaskFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Consumer;

/**
 * Polls the platform for one background task until it reaches a terminal state,
 * the polling deadline passes, or the task is resolved elsewhere.
 * <p>
 * The deadline is created_at + max polling duration, so a restart does not extend it.
 * Every write is a guarded transition; losing a race to a reviewer simply ends the worker.
 */
public class BackgroundPollWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(BackgroundPollWorker.class);

    public static final String POLLING_TIMEOUT = "polling_timeout";

    private final String taskId;
    private final PollingContext ctx;
    private final Consumer<BackgroundPollWorker> onTerminal;

    private volatile WorkerState state = WorkerState.SCHEDULED;
    private volatile ScheduledFuture<?> future;
    private int polls;

    BackgroundPollWorker(String taskId, PollingContext ctx, Consumer<BackgroundPollWorker> onTerminal) {
        this.taskId = taskId;
        this.ctx = ctx;
        this.onTerminal = onTerminal;
    }

    @Override
    public void run() {
        if (state == WorkerState.TERMINAL) {
            cancel();
            return;
        }
        state = WorkerState.POLLING;
        boolean finished;
        try {
            finished = pollOnce();
        } catch (Exception e) {
            log.error("Background poll for task {} failed", taskId, e);
            failAfterError(e);
            finished = true;
        }
        if (finished) {
            terminate();
        } else {
            state = WorkerState.SCHEDULED;
        }
    }

    /**
     * @return true when polling is over for this task
     */
    boolean pollOnce() {
        Optional<Task> loaded = ctx.tasks().findById(taskId);
        if (loaded.isEmpty()) {
            log.warn("Background task {} no longer exists, stopping", taskId);
            return true;
        }
        Task task = loaded.get();
        if (task.status() != TaskStatus.WORKING) {
            log.info("Background task {} is {}, stopping poll", taskId, task.status().wireName());
            return true;
        }

        Instant now = ctx.clock().instant();
        if (!now.isBefore(task.createdAt().plus(ctx.maxPolling()))) {
            handleTimeout(task, now);
            return true;
        }

        AdServerAdapter adapter = ctx.policyResolver().adapterFor(task.tenantId());
        MediaBuyStatus status;
        try {
            status = ctx.locks().withLock(ExecutionLocks.mediaBuyKey(task.mediaBuyId()),
                    () -> adapter.checkMediaBuyStatus(task.mediaBuyId(), now));
        } catch (AdapterException e) {
            if (e.isTransient()) {
                log.warn("Status check for {} failed transiently, will poll again: {}", task.mediaBuyId(),
                        e.getMessage());
                return false;
            }
            fail(task, e.detail(), AuditEntry.TASK_POLLING_FAILED, now);
            return true;
        }
        polls++;

        if (!status.status().isTerminal()) {
            log.debug("Media buy {} still {} after {} polls", task.mediaBuyId(), status.status().wireName(), polls);
            return false;
        }
        if (status.status().isSuccess()) {
            complete(task, adapter, status, now);
        } else {
            String detail = "platform reported " + status.status().wireName()
                    + (status.detail() != null ? ": " + status.detail() : "");
            fail(task, detail, AuditEntry.TASK_POLLING_FAILED, now);
        }
        return true;
    }

    private void complete(Task task, AdServerAdapter adapter, MediaBuyStatus status, Instant now) {
        String detail = "platform status " + status.status().wireName() + " after " + polls + " polls";
        ResolveOutcome outcome = ctx.tasks().resolve(task.id(), Resolution.APPROVED, detail,
                TaskFactory.BACKGROUND_ASSIGNEE, now);
        if (!outcome.isResolved()) {
            log.info("Background task {} was resolved elsewhere ({}), not completing", task.id(),
                    outcome.task() != null ? outcome.task().status().wireName() : "missing");
            return;
        }

        ctx.taskFactory().audit(task, AuditEntry.TASK_POLLING_COMPLETED, TaskFactory.SYSTEM_ACTOR, detail);
        ctx.taskFactory().notifyResolved(task.id());
        log.info("Media buy {} reached {} - background task {} completed", task.mediaBuyId(),
                status.status().wireName(), task.id());

        if (task.parentTaskId() != null) {
            finishParent(task.parentTaskId(), TaskStatus.COMPLETED, AuditEntry.TASK_EXECUTED,
                    "completed after background polling: media_buy_id=" + task.mediaBuyId(), now);
        }

        Operation operation = ctx.codec().decodeOperation(task.requestContext(), task.toolName());
        if (operation instanceof CreateMediaBuyOperation create) {
            ctx.deliveryTracking().start(adapter, DeliveryTarget.of(task.mediaBuyId(), task.tenantId(), create));
        }
    }

    private void handleTimeout(Task task, Instant now) {
        if (!ctx.tasks().transition(task.id(), TaskStatus.WORKING, TaskStatus.FAILED, POLLING_TIMEOUT, now)) {
            log.info("Background task {} changed state before timeout could be recorded", task.id());
            return;
        }
        log.warn("Background task {} timed out after {} polling media buy {}", task.id(), ctx.maxPolling(),
                task.mediaBuyId());
        ctx.taskFactory().audit(task, AuditEntry.TASK_POLLING_TIMEOUT, TaskFactory.SYSTEM_ACTOR,
                "no terminal status within " + ctx.maxPolling());
        ctx.taskFactory().notifyResolved(task.id());

        // Only the winner of the transition above gets here, so exactly one escalation is created.
        UpdateMediaBuyOperation activation = UpdateMediaBuyOperation.activate(task.mediaBuyId());
        Task escalation = ctx.taskFactory().createApprovalTask(task.tenantId(), task.principalId(), activation,
                ActionDetailsBuilders.activation(activation, platformName(task)));
        ctx.taskFactory().audit(task, AuditEntry.TASK_ESCALATED, TaskFactory.SYSTEM_ACTOR,
                "escalated to manual task " + escalation.id());

        if (task.parentTaskId() != null) {
            finishParent(task.parentTaskId(), TaskStatus.FAILED, AuditEntry.TASK_EXECUTION_FAILED,
                    POLLING_TIMEOUT + ", escalated to task " + escalation.id(), now);
        }
    }

    private void fail(Task task, String detail, String auditEvent, Instant now) {
        if (!ctx.tasks().transition(task.id(), TaskStatus.WORKING, TaskStatus.FAILED, detail, now)) {
            return;
        }
        log.warn("Background task {} failed: {}", task.id(), detail);
        ctx.taskFactory().audit(task, auditEvent, TaskFactory.SYSTEM_ACTOR, detail);
        ctx.taskFactory().notifyResolved(task.id());
        if (task.parentTaskId() != null) {
            finishParent(task.parentTaskId(), TaskStatus.FAILED, AuditEntry.TASK_EXECUTION_FAILED, detail, now);
        }
    }

    private void failAfterError(Exception error) {
        try {
            ctx.tasks().findById(taskId).ifPresent(task -> {
                if (task.status() == TaskStatus.WORKING) {
                    fail(task, "internal error: " + error.getMessage(), AuditEntry.TASK_POLLING_FAILED,
                            ctx.clock().instant());
                }
            });
        } catch (RuntimeException e) {
            log.error("Could not mark background task {} failed", taskId, e);
        }
    }

    private void finishParent(String parentId, TaskStatus to, String auditEvent, String detail, Instant now) {
        if (!ctx.tasks().transition(parentId, TaskStatus.WORKING, to, detail, now)) {
            log.debug("Parent task {} not WORKING, left unchanged", parentId);
            return;
        }
        ctx.tasks().findById(parentId).ifPresent(parent ->
                ctx.taskFactory().audit(parent, auditEvent, TaskFactory.SYSTEM_ACTOR, detail));
        ctx.taskFactory().notifyResolved(parentId);
    }

    private String platformName(Task task) {
        try {
            return ctx.policyResolver().adapterFor(task.tenantId()).platformName();
        } catch (PolicyLookupException e) {
            return "the ad server";
        }
    }

    void attach(ScheduledFuture<?> future) {
        this.future = future;
        if (state == WorkerState.TERMINAL) {
            future.cancel(false);
        }
    }

    void cancel() {
        state = WorkerState.TERMINAL;
        ScheduledFuture<?> f = future;
        if (f != null) {
            f.cancel(false);
        }
    }

    private void terminate() {
        cancel();
        onTerminal.accept(this);
    }

    public String taskId() {
        return taskId;
    }
}
