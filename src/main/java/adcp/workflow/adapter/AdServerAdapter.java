package adcp.workflow.adapter;

import adcp.workflow.operation.CreateMediaBuyOperation;
import adcp.workflow.operation.CreativeAsset;
import adcp.workflow.operation.MediaPackage;

import java.time.Instant;
import java.util.List;

/**
 * Contract every ad server integration (GAM, Kevel, mock, ...) satisfies.
 * Calls are synchronous from the engine's point of view. A call either returns,
 * reports {@link PlatformStatus#PENDING} for asynchronous platform processing,
 * or throws {@link AdapterException}.
 */
public interface AdServerAdapter {

    /**
     * Registry key, matched against {@code TenantPolicy.adServer()}.
     */
    String name();

    /**
     * Human-readable platform name used in reviewer instructions.
     */
    default String platformName() {
        return name();
    }

    CreateMediaBuyResult createMediaBuy(CreateMediaBuyOperation request, List<MediaPackage> packages,
            Instant start, Instant end) throws AdapterException;

    /**
     * @param packageId required for package-level actions, otherwise null
     * @param budget    required for budget/impression updates, otherwise null
     */
    UpdateMediaBuyResult updateMediaBuy(String mediaBuyId, String action, String packageId, Double budget,
            Instant today) throws AdapterException;

    List<AssetStatus> addCreativeAssets(String mediaBuyId, List<CreativeAsset> assets, Instant today)
            throws AdapterException;

    MediaBuyStatus checkMediaBuyStatus(String mediaBuyId, Instant today) throws AdapterException;

    DeliveryReport getMediaBuyDelivery(String mediaBuyId, DateRange dateRange, Instant today)
            throws AdapterException;

    /**
     * Whether {@link #getMediaBuyDelivery} reflects real platform delivery.
     * Adapters returning false get simulated delivery webhooks instead.
     */
    default boolean reportsLiveDelivery() {
        return false;
    }
}
