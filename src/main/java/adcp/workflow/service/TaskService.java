package adcp.workflow.service;

import adcp.workflow.audit.AuditEntry;
import adcp.workflow.model.ErrorCode;
import adcp.workflow.model.Resolution;
import adcp.workflow.model.ResolveOutcome;
import adcp.workflow.model.Task;
import adcp.workflow.model.TaskQuery;
import adcp.workflow.model.TaskStatus;
import adcp.workflow.repository.TaskRepository;
import adcp.workflow.scheduler.BackgroundPollerSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Task API used by reviewers: list pending work and resolve tasks.
 * Errors come back as typed {@link TaskResolution}s; nothing here throws for a caller mistake.
 */
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    private final TaskRepository tasks;
    private final TaskFactory taskFactory;
    private final DeferredExecutionResumer resumer;
    private final BackgroundPollerSupervisor supervisor;
    private final Clock clock;

    public TaskService(TaskRepository tasks, TaskFactory taskFactory, DeferredExecutionResumer resumer,
            BackgroundPollerSupervisor supervisor, Clock clock) {
        this.tasks = tasks;
        this.taskFactory = taskFactory;
        this.resumer = resumer;
        this.supervisor = supervisor;
        this.clock = clock;
    }

    /**
     * List tasks for review.
     *
     * @param tenantId restrict to one tenant, or null for all
     * @param status   status filter; null means pending_approval
     * @param overdue  true/false to filter on the overdue flag, null for both
     */
    public List<TaskSummary> getPendingTasks(String tenantId, TaskStatus status, Boolean overdue) {
        TaskQuery query = status == null
                ? TaskQuery.pendingForReview(tenantId).withOverdue(overdue)
                : new TaskQuery(tenantId, status, overdue, true, TaskQuery.DEFAULT_LIMIT);
        Instant now = clock.instant();
        return tasks.list(query, now).stream()
                .map(t -> new TaskSummary(t, t.isOverdue(now)))
                .toList();
    }

    public Optional<TaskSummary> findTask(String taskId) {
        Instant now = clock.instant();
        return tasks.findById(taskId).map(t -> new TaskSummary(t, t.isOverdue(now)));
    }

    /**
     * Resolve a task. Approval runs the stored operation before this returns; a duplicate
     * resolution returns the stored task with {@link ErrorCode#DUPLICATE_RESOLUTION}.
     */
    public TaskResolution completeTask(String taskId, Resolution resolution, String detail, String resolvedBy) {
        if (taskId == null || taskId.isBlank()) {
            return TaskResolution.error(ErrorCode.INVALID_REQUEST, "task_id is required");
        }
        if (resolution == null) {
            return TaskResolution.error(ErrorCode.INVALID_REQUEST, "resolution is required");
        }
        if (resolvedBy == null || resolvedBy.isBlank()) {
            return TaskResolution.error(ErrorCode.INVALID_REQUEST, "resolved_by is required");
        }

        try {
            return resolve(taskId, resolution, detail, resolvedBy);
        } catch (RuntimeException e) {
            log.error("Resolving task {} as {} failed", taskId, resolution.wireName(), e);
            return TaskResolution.error(ErrorCode.INTERNAL_ERROR, "task storage error: " + e.getMessage());
        }
    }

    private TaskResolution resolve(String taskId, Resolution resolution, String detail, String resolvedBy) {
        Optional<Task> existing = tasks.findById(taskId);
        if (existing.isEmpty()) {
            return TaskResolution.error(ErrorCode.TASK_NOT_FOUND, "task not found: " + taskId);
        }
        if (existing.get().isBackground() && resolution == Resolution.APPROVED && !existing.get().isResolved()) {
            return TaskResolution.error(ErrorCode.NOT_RESOLVABLE,
                    "background task " + taskId + " completes from platform status, it can only be rejected",
                    existing.get());
        }

        ResolveOutcome outcome = tasks.resolve(taskId, resolution, detail, resolvedBy, clock.instant());
        switch (outcome.result()) {
            case NOT_FOUND:
                return TaskResolution.error(ErrorCode.TASK_NOT_FOUND, "task not found: " + taskId);
            case ALREADY_RESOLVED:
                log.info("Task {} already resolved ({}), ignoring {} from {}", taskId,
                        outcome.task().status().wireName(), resolution.wireName(), resolvedBy);
                return TaskResolution.duplicate(outcome.task());
            default:
                break;
        }

        Task resolved = outcome.task();
        log.info("Task {} {} by {}", taskId, resolution.wireName(), resolvedBy);

        if (resolved.isBackground()) {
            cancelBackground(resolved);
            return TaskResolution.resolved(resolved, ExecutionOutcome.REJECTED);
        }

        ExecutionOutcome execution = resumer.onTaskResolved(resolved);
        Task after = tasks.findById(taskId).orElse(resolved);
        return TaskResolution.resolved(after, execution);
    }

    private void cancelBackground(Task task) {
        supervisor.cancel(task.id());
        taskFactory.audit(task, AuditEntry.TASK_REJECTED, task.resolvedBy(), task.resolutionDetail());
        taskFactory.notifyResolved(task.id());

        String parentId = task.parentTaskId();
        if (parentId == null) {
            return;
        }
        String detail = "background task " + task.id() + " rejected by " + task.resolvedBy();
        if (tasks.transition(parentId, TaskStatus.WORKING, TaskStatus.FAILED, detail, clock.instant())) {
            tasks.findById(parentId).ifPresent(parent ->
                    taskFactory.audit(parent, AuditEntry.TASK_EXECUTION_FAILED, TaskFactory.SYSTEM_ACTOR, detail));
            taskFactory.notifyResolved(parentId);
        }
    }
}
