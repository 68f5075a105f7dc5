package adcp.workflow.adapter;

import java.util.Objects;

/**
 * Adapter response to create_media_buy.
 */
public record CreateMediaBuyResult(String mediaBuyId, PlatformStatus status, String detail) {
    public CreateMediaBuyResult {
        Objects.requireNonNull(status, "status is required");
    }
}
