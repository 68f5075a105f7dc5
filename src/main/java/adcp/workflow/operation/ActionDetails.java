package adcp.workflow.operation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Human-readable description of what approving a task will do, shown to reviewers.
 *
 * @param automationMode {@code manual}, {@code confirmation_required} or {@code background_polling}
 * @param attributes     kind-specific extras (campaign name, budget, polling interval, ...)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ActionDetails(
        @JsonProperty("action_type") String actionType,
        @JsonProperty("media_buy_id") String mediaBuyId,
        @JsonProperty("platform") String platform,
        @JsonProperty("automation_mode") String automationMode,
        @JsonProperty("instructions") List<String> instructions,
        @JsonProperty("attributes") Map<String, Object> attributes) {

    public static final String MODE_MANUAL = "manual";
    public static final String MODE_CONFIRMATION_REQUIRED = "confirmation_required";
    public static final String MODE_BACKGROUND_POLLING = "background_polling";

    public ActionDetails {
        instructions = instructions == null ? List.of() : List.copyOf(instructions);
        // LinkedHashMap keeps insertion order and tolerates null values
        attributes = attributes == null ? Map.of() : new LinkedHashMap<>(attributes);
    }
}
