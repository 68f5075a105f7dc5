package adcp.workflow.testing;

import adcp.workflow.config.WorkflowConfig;
import adcp.workflow.operation.AddCreativeAssetsOperation;
import adcp.workflow.operation.CreateMediaBuyOperation;
import adcp.workflow.operation.CreativeAsset;
import adcp.workflow.operation.MediaPackage;
import adcp.workflow.operation.UpdateMediaBuyOperation;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Shared operations and config for tests.
 */
public final class Fixtures {

    public static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");
    public static final Instant FLIGHT_START = Instant.parse("2026-03-03T00:00:00Z");
    public static final Instant FLIGHT_END = Instant.parse("2026-03-10T00:00:00Z");

    private Fixtures() {
    }

    public static String h2Url(String name) {
        return "jdbc:h2:mem:test-" + name + "-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    }

    /** Fast polling, no outgoing HTTP, simulation ticks far apart. */
    public static WorkflowConfig testConfig(String name) {
        return WorkflowConfig.defaults()
                .withDatabaseUrl(h2Url(name))
                .withPollInterval(Duration.ofMillis(20))
                .withMaxPollingDuration(Duration.ofMinutes(15))
                .withWebhookInitialBackoff(Duration.ofMillis(10))
                .withSimulationInterval(Duration.ofHours(1));
    }

    public static CreateMediaBuyOperation createMediaBuy() {
        return new CreateMediaBuyOperation(
                "buyer-ref-1",
                "PO-1001",
                "Spring Sale",
                List.of(new MediaPackage("pkg_1", "Homepage takeover", 100_000, 10.0, "guaranteed", null),
                        new MediaPackage("pkg_2", "Run of site", 68_000, 5.0, "non_guaranteed", 340.0)),
                FLIGHT_START,
                FLIGHT_END,
                1_340.0,
                "USD");
    }

    public static UpdateMediaBuyOperation pause(String mediaBuyId) {
        return new UpdateMediaBuyOperation(mediaBuyId, UpdateMediaBuyOperation.PAUSE_MEDIA_BUY, null, null);
    }

    public static AddCreativeAssetsOperation creatives(String mediaBuyId) {
        return new AddCreativeAssetsOperation(mediaBuyId, List.of(
                new CreativeAsset("cr_1", "Banner", "display_300x250", "https://cdn.example.com/cr_1.png",
                        List.of("pkg_1")),
                new CreativeAsset("cr_2", "Video", "video_15s", "https://cdn.example.com/cr_2.mp4",
                        List.of("pkg_2"))));
    }
}
