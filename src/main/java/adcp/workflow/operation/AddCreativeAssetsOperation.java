package adcp.workflow.operation;

import adcp.workflow.model.TaskAction;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * add_creative_assets request: assign creatives to an existing media buy.
 */
public record AddCreativeAssetsOperation(
        @JsonProperty("media_buy_id") String mediaBuyId,
        @JsonProperty("assets") List<CreativeAsset> assets) implements Operation {

    public AddCreativeAssetsOperation {
        assets = assets == null ? List.of() : List.copyOf(assets);
    }

    @Override
    public OperationKind kind() {
        return OperationKind.ADD_CREATIVE_ASSETS;
    }

    @Override
    public TaskAction taskAction() {
        return TaskAction.APPROVE;
    }

    @Override
    public void validate() {
        if (mediaBuyId == null || mediaBuyId.isBlank()) {
            throw new IllegalArgumentException("media_buy_id is required");
        }
        if (assets.isEmpty()) {
            throw new IllegalArgumentException("at least one asset is required");
        }
        for (CreativeAsset asset : assets) {
            if (asset.creativeId() == null || asset.creativeId().isBlank()) {
                throw new IllegalArgumentException("creative_id is required for every asset");
            }
        }
    }
}
