package adcp.workflow.webhook;

import java.util.Locale;

public enum EventType {
    TASK_CREATED,
    TASK_RESOLVED,
    DELIVERY_PROGRESS,
    DELIVERY_COMPLETED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
