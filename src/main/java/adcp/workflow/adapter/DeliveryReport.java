package adcp.workflow.adapter;

/**
 * Delivery totals for a media buy over a reporting period.
 */
public record DeliveryReport(String mediaBuyId, long impressions, double spend) {
}
