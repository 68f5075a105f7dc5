package adcp.workflow.operation;

import adcp.workflow.adapter.AdServerAdapter;
import adcp.workflow.adapter.AdapterException;
import adcp.workflow.adapter.AssetStatus;
import adcp.workflow.adapter.CreateMediaBuyResult;
import adcp.workflow.adapter.PlatformStatus;
import adcp.workflow.adapter.UpdateMediaBuyResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Locale;

/**
 * Issues exactly one adapter call for an operation. Used both for immediate execution
 * and for resuming an approved task, so both paths share one dispatch.
 */
public class OperationExecutor {

    private static final Logger log = LoggerFactory.getLogger(OperationExecutor.class);

    private final Clock clock;

    public OperationExecutor(Clock clock) {
        this.clock = clock;
    }

    public ExecutionResult execute(AdServerAdapter adapter, Operation operation) throws AdapterException {
        log.debug("Executing {} on adapter {}", operation.kind().toolName(), adapter.name());

        return switch (operation.kind()) {
            case CREATE_MEDIA_BUY -> {
                CreateMediaBuyOperation op = (CreateMediaBuyOperation) operation;
                CreateMediaBuyResult result = adapter.createMediaBuy(op, op.packages(), op.flightStart(),
                        op.flightEnd());
                yield new ExecutionResult(result.mediaBuyId(), result.status(), result.detail(), List.of());
            }
            case UPDATE_MEDIA_BUY -> {
                UpdateMediaBuyOperation op = (UpdateMediaBuyOperation) operation;
                UpdateMediaBuyResult result = adapter.updateMediaBuy(op.mediaBuyId(), op.action(), op.packageId(),
                        op.budget(), clock.instant());
                yield new ExecutionResult(op.mediaBuyId(), result.status(), result.reason(), List.of());
            }
            case ADD_CREATIVE_ASSETS -> {
                AddCreativeAssetsOperation op = (AddCreativeAssetsOperation) operation;
                List<AssetStatus> statuses = adapter.addCreativeAssets(op.mediaBuyId(), op.assets(), clock.instant());
                yield new ExecutionResult(op.mediaBuyId(), creativeStatus(statuses), null, statuses);
            }
        };
    }

    /**
     * Creatives still under platform review count as pending; any rejection fails the batch.
     */
    private static PlatformStatus creativeStatus(List<AssetStatus> statuses) {
        boolean pending = false;
        for (AssetStatus s : statuses) {
            String status = s.status() == null ? "" : s.status().toLowerCase(Locale.ROOT);
            if (status.equals("rejected")) {
                return PlatformStatus.REJECTED;
            }
            if (status.startsWith("pending")) {
                pending = true;
            }
        }
        return pending ? PlatformStatus.PENDING : PlatformStatus.ACTIVE;
    }
}
