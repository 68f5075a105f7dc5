package adcp.workflow.service;

import adcp.workflow.audit.AuditEntry;
import adcp.workflow.audit.AuditSink;
import adcp.workflow.model.StepType;
import adcp.workflow.model.Task;
import adcp.workflow.model.TaskAction;
import adcp.workflow.model.TaskOwner;
import adcp.workflow.model.TaskStatus;
import adcp.workflow.operation.ActionDetails;
import adcp.workflow.operation.Operation;
import adcp.workflow.operation.RequestContextCodec;
import adcp.workflow.repository.TaskRepository;
import adcp.workflow.webhook.WebhookDispatcher;
import adcp.workflow.webhook.WebhookEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Creates and persists tasks, with their audit entry and task_created webhook.
 * Also the single place that records audit entries for existing tasks.
 */
public class TaskFactory {

    private static final Logger log = LoggerFactory.getLogger(TaskFactory.class);

    public static final String BACKGROUND_ASSIGNEE = "background_approval_service";
    public static final String SYSTEM_ACTOR = "system";

    private final TaskRepository tasks;
    private final AuditSink audit;
    private final WebhookDispatcher webhooks;
    private final RequestContextCodec codec;
    private final Clock clock;

    public TaskFactory(TaskRepository tasks, AuditSink audit, WebhookDispatcher webhooks, RequestContextCodec codec,
            Clock clock) {
        this.tasks = tasks;
        this.audit = audit;
        this.webhooks = webhooks;
        this.codec = codec;
        this.clock = clock;
    }

    /**
     * Persist a publisher-owned task awaiting review, due after the operation's SLA.
     */
    public Task createApprovalTask(String tenantId, String principalId, Operation operation, ActionDetails details) {
        Instant now = clock.instant();
        StepType stepType = operation.kind().stepType();
        Task task = Task.builder()
                .id(newId(stepType))
                .tenantId(tenantId)
                .principalId(principalId)
                .stepType(stepType)
                .toolName(operation.kind().toolName())
                .status(TaskStatus.PENDING_APPROVAL)
                .owner(TaskOwner.PUBLISHER)
                .action(operation.taskAction())
                .mediaBuyId(operation.mediaBuyId())
                .requestContext(codec.encode(operation, details))
                .createdAt(now)
                .dueAt(now.plus(operation.kind().sla()))
                .build();

        tasks.create(task);
        audit(task, AuditEntry.TASK_CREATED, principalId,
                operation.kind().toolName() + " awaiting approval, due " + task.dueAt());
        webhooks.notify(WebhookEvent.taskCreated(task, now));

        log.info("Task {} created for {} (tenant {}, due {})", task.id(), task.toolName(), tenantId, task.dueAt());
        return task;
    }

    /**
     * Persist a system-owned polling task.
     *
     * @param parentTaskId approval task this continues, or null for an operation executed without review
     */
    public Task createBackgroundTask(String tenantId, String principalId, String parentTaskId, Operation operation,
            String mediaBuyId, ActionDetails details, Duration maxPolling) {
        Instant now = clock.instant();
        Task task = Task.builder()
                .id(newId(StepType.BACKGROUND_TASK))
                .tenantId(tenantId)
                .principalId(principalId)
                .stepType(StepType.BACKGROUND_TASK)
                .toolName(operation.kind().toolName())
                .status(TaskStatus.WORKING)
                .owner(TaskOwner.SYSTEM)
                .action(TaskAction.APPROVE)
                .mediaBuyId(mediaBuyId)
                .requestContext(codec.encode(operation, details))
                .assignedTo(BACKGROUND_ASSIGNEE)
                .parentTaskId(parentTaskId)
                .createdAt(now)
                .dueAt(now.plus(maxPolling))
                .build();

        tasks.create(task);
        audit(task, AuditEntry.TASK_BACKGROUND_STARTED, SYSTEM_ACTOR,
                parentTaskId != null ? "polling " + mediaBuyId + " for task " + parentTaskId : "polling " + mediaBuyId);
        webhooks.notify(WebhookEvent.taskCreated(task, now));

        log.info("Background task {} created for media buy {} (parent {})", task.id(), mediaBuyId, parentTaskId);
        return task;
    }

    public void audit(Task task, String event, String actor, String detail) {
        audit.record(AuditEntry.of(task.tenantId(), task.id(), event, actor, detail, clock.instant()));
    }

    /**
     * Reload a task and fire task_resolved with its stored state.
     */
    public void notifyResolved(String taskId) {
        tasks.findById(taskId).ifPresent(t -> webhooks.notify(WebhookEvent.taskResolved(t, clock.instant())));
    }

    private static String newId(StepType stepType) {
        String prefix = switch (stepType) {
            case CREATION -> "c";
            case APPROVAL -> "a";
            case BACKGROUND_TASK -> "b";
        };
        return prefix + "_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }
}
