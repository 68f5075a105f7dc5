package adcp.workflow.webhook;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Data block of a delivery webhook.
 */
public record DeliveryUpdate(
        @JsonProperty("event_type") String eventType,
        @JsonProperty("media_buy_id") String mediaBuyId,
        @JsonProperty("progress") Progress progress,
        @JsonProperty("delivery") Delivery delivery) {

    public static final String EVENT_TYPE = "delivery_update";

    public DeliveryUpdate(String mediaBuyId, Progress progress, Delivery delivery) {
        this(EVENT_TYPE, mediaBuyId, progress, delivery);
    }

    /**
     * Snapshot of a media buy's delivery at a point in its flight.
     *
     * @param elapsedSeconds flight time elapsed (simulated or real)
     * @param totalSeconds   full flight duration
     */
    public static DeliveryUpdate snapshot(String mediaBuyId, double elapsedSeconds, double totalSeconds,
            long impressions, double spend, double totalBudget) {
        double progress = totalSeconds <= 0 ? 1.0 : Math.min(elapsedSeconds / totalSeconds, 1.0);
        double expectedSpend = totalBudget * progress;
        double pacing = expectedSpend > 0 ? spend / expectedSpend * 100.0 : 0.0;
        return new DeliveryUpdate(mediaBuyId,
                new Progress(round2(elapsedSeconds / 3600.0), round2(totalSeconds / 3600.0), round2(progress * 100.0)),
                new Delivery(impressions, round2(spend), totalBudget, round2(pacing)));
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    public record Progress(
            @JsonProperty("elapsed_hours") double elapsedHours,
            @JsonProperty("total_hours") double totalHours,
            @JsonProperty("progress_percentage") double progressPercentage) {
    }

    public record Delivery(
            @JsonProperty("impressions") long impressions,
            @JsonProperty("spend") double spend,
            @JsonProperty("total_budget") double totalBudget,
            @JsonProperty("pacing_percentage") double pacingPercentage) {
    }
}
