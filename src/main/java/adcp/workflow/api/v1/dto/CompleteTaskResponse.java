package adcp.workflow.api.v1.dto;

import adcp.workflow.service.TaskResolution;
import adcp.workflow.service.TaskSummary;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Locale;

/**
 * Response DTO for task resolution. A duplicate resolution is reported with
 * {@code duplicate=true} and the task as first resolved.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompleteTaskResponse(
        @JsonProperty("success") boolean success,
        @JsonProperty("duplicate") boolean duplicate,
        @JsonProperty("execution") String execution,
        @JsonProperty("task") TaskSummaryResponse task) {

    public static CompleteTaskResponse from(TaskResolution resolution, Instant now) {
        return new CompleteTaskResponse(
                true,
                resolution.isDuplicate(),
                resolution.execution() != null ? resolution.execution().name().toLowerCase(Locale.ROOT) : null,
                TaskSummaryResponse.from(new TaskSummary(resolution.task(), resolution.task().isOverdue(now))));
    }
}
