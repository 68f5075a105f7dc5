package adcp.workflow.model;

import java.util.Locale;

public enum TaskOwner {
    PUBLISHER,
    SYSTEM;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
