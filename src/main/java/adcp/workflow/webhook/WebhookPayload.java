package adcp.workflow.webhook;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Envelope POSTed to webhook receivers.
 *
 * @param taskId task id for task events, media buy id for delivery events
 * @param status task status, or started / delivering / completed for delivery events
 * @param data   {@link DeliveryUpdate} or {@link TaskEventData}
 */
public record WebhookPayload(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("status") String status,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("data") Object data) {
}
