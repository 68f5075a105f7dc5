package adcp.workflow.adapter;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-creative status returned by add_creative_assets ({@code approved}, {@code pending_review}, {@code rejected}).
 */
public record AssetStatus(
        @JsonProperty("creative_id") String creativeId,
        @JsonProperty("status") String status) {
}
