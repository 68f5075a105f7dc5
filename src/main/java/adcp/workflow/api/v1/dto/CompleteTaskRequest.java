package adcp.workflow.api.v1.dto;

import adcp.workflow.model.Resolution;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for resolving a task.
 * POST /api/v1/tasks/{taskId}/complete
 */
public record CompleteTaskRequest(
        @JsonProperty("resolution") String resolution,
        @JsonProperty("detail") String detail,
        @JsonProperty("resolved_by") String resolvedBy) {

    public void validate() {
        parsedResolution();
        if (resolvedBy == null || resolvedBy.isBlank()) {
            throw new IllegalArgumentException("resolved_by is required");
        }
    }

    public Resolution parsedResolution() {
        return Resolution.fromWire(resolution);
    }
}
