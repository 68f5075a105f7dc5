package adcp.workflow.webhook;

import adcp.workflow.model.Task;

import java.time.Instant;
import java.util.Objects;

/**
 * An event handed to the dispatcher: its type plus the payload every receiver gets.
 */
public record WebhookEvent(EventType type, WebhookPayload payload) {

    public WebhookEvent {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(payload, "payload is required");
    }

    public static WebhookEvent taskCreated(Task task, Instant at) {
        return forTask(EventType.TASK_CREATED, task, at);
    }

    public static WebhookEvent taskResolved(Task task, Instant at) {
        return forTask(EventType.TASK_RESOLVED, task, at);
    }

    /**
     * @param status started, delivering or completed; completed maps to {@link EventType#DELIVERY_COMPLETED}
     */
    public static WebhookEvent delivery(String mediaBuyId, String status, DeliveryUpdate update, Instant at) {
        EventType type = "completed".equals(status) ? EventType.DELIVERY_COMPLETED : EventType.DELIVERY_PROGRESS;
        return new WebhookEvent(type, new WebhookPayload(mediaBuyId, status, at, update));
    }

    private static WebhookEvent forTask(EventType type, Task task, Instant at) {
        return new WebhookEvent(type,
                new WebhookPayload(task.id(), task.status().wireName(), at, TaskEventData.of(type, task)));
    }
}
