package adcp.workflow.model;

import java.util.Locale;

/**
 * Workflow task status.
 */
public enum TaskStatus {
    /** Waiting for a human reviewer */
    PENDING_APPROVAL,
    /** Approved and executing, or a background task still polling */
    WORKING,
    /** Operation reached the platform successfully */
    COMPLETED,
    /** Rejected by a reviewer (or a background task cancelled by rejection) */
    REJECTED,
    /** Adapter error, polling timeout or internal failure */
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == REJECTED || this == FAILED;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TaskStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("status is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown status: " + value);
        }
    }
}
