package adcp.workflow.operation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record CreativeAsset(
        @JsonProperty("creative_id") String creativeId,
        @JsonProperty("name") String name,
        @JsonProperty("format") String format,
        @JsonProperty("url") String url,
        @JsonProperty("package_assignments") List<String> packageAssignments) {

    public CreativeAsset {
        packageAssignments = packageAssignments == null ? List.of() : List.copyOf(packageAssignments);
    }
}
