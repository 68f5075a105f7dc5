package adcp.workflow.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("database") String database,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("pending_tasks") Integer pendingTasks,
        @JsonProperty("active_pollers") Integer activePollers,
        @JsonProperty("webhooks_delivered") Long webhooksDelivered,
        @JsonProperty("webhooks_failed") Long webhooksFailed) {

    public static HealthResponse healthy(String uptime, String version, int pendingTasks, int activePollers,
            long webhooksDelivered, long webhooksFailed) {
        return new HealthResponse("healthy", "ok", uptime, version, pendingTasks, activePollers,
                webhooksDelivered, webhooksFailed);
    }

    public static HealthResponse unhealthy(String database) {
        return new HealthResponse("unhealthy", database, null, null, null, null, null, null);
    }
}
