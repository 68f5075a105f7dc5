package adcp.workflow.adapter;

import java.util.Locale;

/**
 * Media buy state as reported by an ad server.
 * {@link #PENDING} means the platform is still processing asynchronously
 * (e.g. a forecast is not available yet).
 */
public enum PlatformStatus {
    PENDING,
    ACTIVE,
    PAUSED,
    COMPLETED,
    REJECTED,
    FAILED;

    public boolean isTerminal() {
        return this != PENDING;
    }

    public boolean isSuccess() {
        return this == ACTIVE || this == PAUSED || this == COMPLETED;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
