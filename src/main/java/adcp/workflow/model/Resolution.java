package adcp.workflow.model;

import java.util.Locale;

/**
 * Terminal decision recorded on a task.
 */
public enum Resolution {
    APPROVED,
    REJECTED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Resolution fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("resolution is required");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "approved", "approve" -> APPROVED;
            case "rejected", "reject" -> REJECTED;
            default -> throw new IllegalArgumentException("resolution must be approved or rejected: " + value);
        };
    }
}
