package adcp.workflow.operation;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One package (line item) of a media buy.
 *
 * @param budget explicit package budget; when null it is derived from impressions and CPM
 */
public record MediaPackage(
        @JsonProperty("package_id") String packageId,
        @JsonProperty("name") String name,
        @JsonProperty("impressions") long impressions,
        @JsonProperty("cpm") double cpm,
        @JsonProperty("delivery_type") String deliveryType,
        @JsonProperty("budget") Double budget) {

    public double effectiveBudget() {
        if (budget != null) {
            return budget;
        }
        return impressions / 1000.0 * cpm;
    }

    public void validate() {
        if (packageId == null || packageId.isBlank()) {
            throw new IllegalArgumentException("package_id is required");
        }
        if (impressions < 0) {
            throw new IllegalArgumentException("impressions must be >= 0 for package " + packageId);
        }
        if (cpm < 0) {
            throw new IllegalArgumentException("cpm must be >= 0 for package " + packageId);
        }
    }
}
