package adcp.workflow.operation;

import adcp.workflow.model.TaskAction;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * create_media_buy request.
 *
 * @param totalBudget overall budget; when null the package budgets are summed
 */
public record CreateMediaBuyOperation(
        @JsonProperty("buyer_ref") String buyerRef,
        @JsonProperty("po_number") String poNumber,
        @JsonProperty("promoted_offering") String promotedOffering,
        @JsonProperty("packages") List<MediaPackage> packages,
        @JsonProperty("flight_start") Instant flightStart,
        @JsonProperty("flight_end") Instant flightEnd,
        @JsonProperty("total_budget") Double totalBudget,
        @JsonProperty("currency") String currency) implements Operation {

    public CreateMediaBuyOperation {
        packages = packages == null ? List.of() : List.copyOf(packages);
    }

    @Override
    public OperationKind kind() {
        return OperationKind.CREATE_MEDIA_BUY;
    }

    @Override
    public String mediaBuyId() {
        return null;
    }

    @Override
    public TaskAction taskAction() {
        return TaskAction.CREATE;
    }

    public double budget() {
        if (totalBudget != null) {
            return totalBudget;
        }
        return packages.stream().mapToDouble(MediaPackage::effectiveBudget).sum();
    }

    public long budgetedImpressions() {
        return packages.stream().mapToLong(MediaPackage::impressions).sum();
    }

    @Override
    public void validate() {
        if (packages.isEmpty()) {
            throw new IllegalArgumentException("at least one package is required");
        }
        packages.forEach(MediaPackage::validate);
        if (flightStart == null || flightEnd == null) {
            throw new IllegalArgumentException("flight_start and flight_end are required");
        }
        if (!flightEnd.isAfter(flightStart)) {
            throw new IllegalArgumentException("flight_end must be after flight_start");
        }
        if (budget() <= 0) {
            throw new IllegalArgumentException("budget must be positive");
        }
    }
}
