package adcp.workflow.api.v1.dto;

import adcp.workflow.model.Task;
import adcp.workflow.service.TaskSummary;
import adcp.workflow.util.Json;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Task as shown to reviewers. Includes the stored action details so a human can act on
 * the platform without reading the raw request context.
 * GET /api/v1/tasks, GET /api/v1/tasks/{id}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskSummaryResponse(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("tenant_id") String tenantId,
        @JsonProperty("tool_name") String toolName,
        @JsonProperty("step_type") String stepType,
        @JsonProperty("status") String status,
        @JsonProperty("owner") String owner,
        @JsonProperty("action") String action,
        @JsonProperty("media_buy_id") String mediaBuyId,
        @JsonProperty("assigned_to") String assignedTo,
        @JsonProperty("parent_task_id") String parentTaskId,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("due_at") Instant dueAt,
        @JsonProperty("overdue") boolean overdue,
        @JsonProperty("resolution") String resolution,
        @JsonProperty("resolution_detail") String resolutionDetail,
        @JsonProperty("resolved_by") String resolvedBy,
        @JsonProperty("resolved_at") Instant resolvedAt,
        @JsonProperty("action_details") JsonNode actionDetails) {

    private static final Logger log = LoggerFactory.getLogger(TaskSummaryResponse.class);

    public static TaskSummaryResponse from(TaskSummary summary) {
        Task task = summary.task();
        return new TaskSummaryResponse(
                task.id(),
                task.tenantId(),
                task.toolName(),
                task.stepType().wireName(),
                task.status().wireName(),
                task.owner().wireName(),
                task.action().wireName(),
                task.mediaBuyId(),
                task.assignedTo(),
                task.parentTaskId(),
                task.createdAt(),
                task.dueAt(),
                summary.overdue(),
                task.resolution() != null ? task.resolution().wireName() : null,
                task.resolutionDetail(),
                task.resolvedBy(),
                task.resolvedAt(),
                actionDetails(task));
    }

    private static JsonNode actionDetails(Task task) {
        try {
            JsonNode details = Json.mapper().readTree(task.requestContext()).get("action_details");
            return details == null || details.isNull() ? null : details;
        } catch (JsonProcessingException e) {
            log.warn("Task {} has unreadable request_context: {}", task.id(), e.getOriginalMessage());
            return null;
        }
    }
}
