package adcp.workflow.adapter;

import java.util.Objects;

/**
 * Adapter response to update_media_buy.
 */
public record UpdateMediaBuyResult(PlatformStatus status, String reason) {
    public UpdateMediaBuyResult {
        Objects.requireNonNull(status, "status is required");
    }
}
