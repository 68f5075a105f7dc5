package adcp.workflow.adapter;

import adcp.workflow.operation.CreateMediaBuyOperation;
import adcp.workflow.operation.CreativeAsset;
import adcp.workflow.operation.MediaPackage;
import adcp.workflow.operation.UpdateMediaBuyOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process ad server used for development and tests.
 * With {@code pollsUntilApproved > 0} new media buys start {@link PlatformStatus#PENDING}
 * and become active after that many status checks, like a platform running an async forecast.
 */
public class MockAdServerAdapter implements AdServerAdapter {

    private static final Logger log = LoggerFactory.getLogger(MockAdServerAdapter.class);

    public static final String NAME = "mock";

    private final int pollsUntilApproved;
    private final Map<String, MockMediaBuy> mediaBuys = new ConcurrentHashMap<>();

    public MockAdServerAdapter() {
        this(0);
    }

    public MockAdServerAdapter(int pollsUntilApproved) {
        if (pollsUntilApproved < 0) {
            throw new IllegalArgumentException("pollsUntilApproved must be >= 0");
        }
        this.pollsUntilApproved = pollsUntilApproved;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String platformName() {
        return "Mock Ad Server";
    }

    @Override
    public CreateMediaBuyResult createMediaBuy(CreateMediaBuyOperation request, List<MediaPackage> packages,
            Instant start, Instant end) throws AdapterException {
        if (packages == null || packages.isEmpty()) {
            throw AdapterException.permanentFailure("media buy has no packages");
        }
        if (start == null || end == null || !end.isAfter(start)) {
            throw AdapterException.permanentFailure("invalid flight dates");
        }

        String id = "mb_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        PlatformStatus status = pollsUntilApproved > 0 ? PlatformStatus.PENDING : PlatformStatus.ACTIVE;
        MockMediaBuy buy = new MockMediaBuy(id, start, end, request.budget(), request.budgetedImpressions(),
                status, pollsUntilApproved);
        mediaBuys.put(id, buy);

        log.info("Mock media buy {} created ({} packages, budget {}, status {})",
                id, packages.size(), request.budget(), status.wireName());
        return new CreateMediaBuyResult(id, status,
                status == PlatformStatus.PENDING ? "forecast pending" : null);
    }

    @Override
    public UpdateMediaBuyResult updateMediaBuy(String mediaBuyId, String action, String packageId, Double budget,
            Instant today) throws AdapterException {
        MockMediaBuy buy = require(mediaBuyId);
        if (action == null) {
            throw AdapterException.permanentFailure("action is required");
        }
        synchronized (buy) {
            switch (action) {
                case UpdateMediaBuyOperation.PAUSE_MEDIA_BUY -> buy.status = PlatformStatus.PAUSED;
                case UpdateMediaBuyOperation.RESUME_MEDIA_BUY, UpdateMediaBuyOperation.ACTIVATE_ORDER ->
                        buy.status = PlatformStatus.ACTIVE;
                case UpdateMediaBuyOperation.PAUSE_PACKAGE, UpdateMediaBuyOperation.RESUME_PACKAGE -> {
                    if (packageId == null) {
                        throw AdapterException.permanentFailure(action + " requires package_id");
                    }
                }
                case UpdateMediaBuyOperation.UPDATE_PACKAGE_BUDGET,
                        UpdateMediaBuyOperation.UPDATE_PACKAGE_IMPRESSIONS -> {
                    if (packageId == null || budget == null) {
                        throw AdapterException.permanentFailure(action + " requires package_id and budget");
                    }
                }
                default -> throw AdapterException.permanentFailure("unsupported action: " + action);
            }
            log.info("Mock media buy {}: {} -> {}", mediaBuyId, action, buy.status.wireName());
            return new UpdateMediaBuyResult(buy.status, null);
        }
    }

    @Override
    public List<AssetStatus> addCreativeAssets(String mediaBuyId, List<CreativeAsset> assets, Instant today)
            throws AdapterException {
        require(mediaBuyId);
        List<AssetStatus> result = new ArrayList<>();
        for (CreativeAsset asset : assets) {
            result.add(new AssetStatus(asset.creativeId(), "approved"));
        }
        return result;
    }

    @Override
    public MediaBuyStatus checkMediaBuyStatus(String mediaBuyId, Instant today) throws AdapterException {
        MockMediaBuy buy = require(mediaBuyId);
        synchronized (buy) {
            if (buy.status == PlatformStatus.PENDING) {
                buy.remainingPolls--;
                if (buy.remainingPolls <= 0) {
                    buy.status = PlatformStatus.ACTIVE;
                    log.info("Mock media buy {} approved by platform", mediaBuyId);
                }
            } else if (buy.status == PlatformStatus.ACTIVE && today != null && !today.isBefore(buy.end)) {
                buy.status = PlatformStatus.COMPLETED;
            }
            return new MediaBuyStatus(mediaBuyId, buy.status, null);
        }
    }

    @Override
    public DeliveryReport getMediaBuyDelivery(String mediaBuyId, DateRange dateRange, Instant today)
            throws AdapterException {
        MockMediaBuy buy = require(mediaBuyId);
        long total = Duration.between(buy.start, buy.end).toSeconds();
        Instant until = today.isBefore(dateRange.end()) ? today : dateRange.end();
        long elapsed = Math.max(0, Duration.between(buy.start, until).toSeconds());
        double progress = total <= 0 ? 1.0 : Math.min((double) elapsed / total, 1.0);
        return new DeliveryReport(mediaBuyId, (long) Math.floor(buy.impressions * progress), buy.budget * progress);
    }

    public PlatformStatus statusOf(String mediaBuyId) {
        MockMediaBuy buy = mediaBuys.get(mediaBuyId);
        return buy == null ? null : buy.status;
    }

    private MockMediaBuy require(String mediaBuyId) throws AdapterException {
        MockMediaBuy buy = mediaBuyId == null ? null : mediaBuys.get(mediaBuyId);
        if (buy == null) {
            throw AdapterException.permanentFailure("media buy not found: " + mediaBuyId);
        }
        return buy;
    }

    private static final class MockMediaBuy {
        final String id;
        final Instant start;
        final Instant end;
        final double budget;
        final long impressions;
        PlatformStatus status;
        int remainingPolls;

        MockMediaBuy(String id, Instant start, Instant end, double budget, long impressions,
                PlatformStatus status, int remainingPolls) {
            this.id = id;
            this.start = start;
            this.end = end;
            this.budget = budget;
            this.impressions = impressions;
            this.status = status;
            this.remainingPolls = remainingPolls;
        }
    }
}
