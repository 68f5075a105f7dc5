package adcp.workflow.audit;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One append-only audit record of a task transition.
 */
public record AuditEntry(
        String id,
        String tenantId,
        String taskId,
        String event,
        String actor,
        String detail,
        Instant createdAt) {

    public static final String TASK_CREATED = "task_created";
    public static final String TASK_REJECTED = "task_rejected";
    public static final String TASK_EXECUTED = "task_executed";
    public static final String TASK_EXECUTION_FAILED = "task_execution_failed";
    public static final String TASK_BACKGROUND_STARTED = "task_background_started";
    public static final String TASK_POLLING_COMPLETED = "task_polling_completed";
    public static final String TASK_POLLING_FAILED = "task_polling_failed";
    public static final String TASK_POLLING_TIMEOUT = "task_polling_timeout";
    public static final String TASK_ESCALATED = "task_escalated";
    public static final String TASK_STALE_EXECUTION = "task_stale_execution";

    public AuditEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(event, "event is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
    }

    public static AuditEntry of(String tenantId, String taskId, String event, String actor, String detail,
            Instant at) {
        return new AuditEntry(UUID.randomUUID().toString(), tenantId, taskId, event, actor, detail, at);
    }
}
