package adcp.workflow.webhook;

import adcp.workflow.model.Task;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Data block of task_created / task_resolved webhooks.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskEventData(
        @JsonProperty("event_type") String eventType,
        @JsonProperty("tenant_id") String tenantId,
        @JsonProperty("tool_name") String toolName,
        @JsonProperty("step_type") String stepType,
        @JsonProperty("action") String action,
        @JsonProperty("media_buy_id") String mediaBuyId,
        @JsonProperty("parent_task_id") String parentTaskId,
        @JsonProperty("due_at") Instant dueAt,
        @JsonProperty("resolution") String resolution,
        @JsonProperty("resolution_detail") String resolutionDetail) {

    static TaskEventData of(EventType type, Task task) {
        return new TaskEventData(
                type.wireName(),
                task.tenantId(),
                task.toolName(),
                task.stepType().wireName(),
                task.action().wireName(),
                task.mediaBuyId(),
                task.parentTaskId(),
                task.dueAt(),
                task.resolution() != null ? task.resolution().wireName() : null,
                task.resolutionDetail());
    }
}
