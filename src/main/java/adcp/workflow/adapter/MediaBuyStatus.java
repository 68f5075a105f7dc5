package adcp.workflow.adapter;

import java.util.Objects;

/**
 * Adapter response to check_media_buy_status.
 */
public record MediaBuyStatus(String mediaBuyId, PlatformStatus status, String detail) {
    public MediaBuyStatus {
        Objects.requireNonNull(status, "status is required");
    }
}
