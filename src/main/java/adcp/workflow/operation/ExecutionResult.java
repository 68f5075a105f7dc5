package adcp.workflow.operation;

import adcp.workflow.adapter.AssetStatus;
import adcp.workflow.adapter.PlatformStatus;

import java.util.List;

/**
 * Normalized result of one adapter call, whatever the operation kind.
 */
public record ExecutionResult(String mediaBuyId, PlatformStatus status, String detail, List<AssetStatus> assets) {

    public ExecutionResult {
        assets = assets == null ? List.of() : List.copyOf(assets);
    }

    public boolean pending() {
        return status == PlatformStatus.PENDING;
    }

    /** One-line summary stored as resolution_detail. */
    public String summary() {
        StringBuilder sb = new StringBuilder(status.wireName());
        if (mediaBuyId != null) {
            sb.append(" media_buy_id=").append(mediaBuyId);
        }
        if (!assets.isEmpty()) {
            sb.append(" assets=").append(assets.size());
        }
        if (detail != null && !detail.isBlank()) {
            sb.append(": ").append(detail);
        }
        return sb.toString();
    }
}
