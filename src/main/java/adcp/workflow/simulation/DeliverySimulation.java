package adcp.workflow.simulation;

import adcp.workflow.delivery.DeliveryTarget;
import adcp.workflow.webhook.DeliveryUpdate;
import adcp.workflow.webhook.WebhookEvent;

import java.time.Duration;
import java.time.Instant;

/**
 * Time-accelerated delivery of one media buy, advanced one tick at a time.
 * Wall-clock elapsed time is ticks x interval, so progress does not depend on scheduler jitter.
 * Not thread-safe; the simulator drives each instance from a single scheduled worker.
 */
public final class DeliverySimulation {

    public static final String STARTED = "started";
    public static final String DELIVERING = "delivering";
    public static final String COMPLETED = "completed";

    private final DeliveryTarget target;
    private final double acceleration;
    private final double intervalSeconds;
    private final double totalSeconds;

    private long ticks;
    private boolean started;
    private boolean completed;

    public DeliverySimulation(DeliveryTarget target, double acceleration, Duration interval) {
        if (acceleration <= 0) {
            throw new IllegalArgumentException("acceleration must be positive");
        }
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        this.target = target;
        this.acceleration = acceleration;
        this.intervalSeconds = interval.toMillis() / 1000.0;
        this.totalSeconds = target.flightDuration().toMillis() / 1000.0;
    }

    /**
     * The initial event, progress 0.
     */
    public WebhookEvent start(Instant now) {
        if (started) {
            throw new IllegalStateException("simulation already started for " + target.mediaBuyId());
        }
        started = true;
        DeliveryUpdate update = DeliveryUpdate.snapshot(target.mediaBuyId(), 0, totalSeconds, 0, 0,
                target.totalBudget());
        return WebhookEvent.delivery(target.mediaBuyId(), STARTED, update, now);
    }

    /**
     * Advance one interval. Returns a delivering event, or the single completed event
     * once progress reaches 1.0; calling again after that is an error.
     */
    public WebhookEvent tick(Instant now) {
        if (!started) {
            throw new IllegalStateException("simulation not started for " + target.mediaBuyId());
        }
        if (completed) {
            throw new IllegalStateException("simulation already completed for " + target.mediaBuyId());
        }
        ticks++;

        double simulatedElapsed = ticks * intervalSeconds * acceleration;
        double progress = Math.min(simulatedElapsed / totalSeconds, 1.0);
        long impressions = (long) Math.floor(target.budgetedImpressions() * progress);
        double spend = target.totalBudget() * progress;

        String status;
        if (progress >= 1.0) {
            completed = true;
            status = COMPLETED;
        } else {
            status = DELIVERING;
        }

        DeliveryUpdate update = DeliveryUpdate.snapshot(target.mediaBuyId(), Math.min(simulatedElapsed, totalSeconds),
                totalSeconds, impressions, spend, target.totalBudget());
        return WebhookEvent.delivery(target.mediaBuyId(), status, update, now);
    }

    public boolean isCompleted() {
        return completed;
    }

    public long ticks() {
        return ticks;
    }

    public DeliveryTarget target() {
        return target;
    }
}
