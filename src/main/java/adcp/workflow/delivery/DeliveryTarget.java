package adcp.workflow.delivery;

import adcp.workflow.operation.CreateMediaBuyOperation;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A media buy whose delivery is being reported.
 */
public record DeliveryTarget(
        String mediaBuyId,
        String tenantId,
        Instant flightStart,
        Instant flightEnd,
        double totalBudget,
        long budgetedImpressions) {

    public DeliveryTarget {
        Objects.requireNonNull(mediaBuyId, "mediaBuyId is required");
        Objects.requireNonNull(flightStart, "flightStart is required");
        Objects.requireNonNull(flightEnd, "flightEnd is required");
        if (!flightEnd.isAfter(flightStart)) {
            throw new IllegalArgumentException("flight end must be after start for " + mediaBuyId);
        }
    }

    public static DeliveryTarget of(String mediaBuyId, String tenantId, CreateMediaBuyOperation op) {
        return new DeliveryTarget(mediaBuyId, tenantId, op.flightStart(), op.flightEnd(), op.budget(),
                op.budgetedImpressions());
    }

    public Duration flightDuration() {
        return Duration.between(flightStart, flightEnd);
    }
}
