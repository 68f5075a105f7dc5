package adcp.workflow.operation;

import adcp.workflow.model.TaskAction;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Set;

/**
 * update_media_buy request: one action against an existing media buy or one of its packages.
 */
public record UpdateMediaBuyOperation(
        @JsonProperty("media_buy_id") String mediaBuyId,
        @JsonProperty("action") String action,
        @JsonProperty("package_id") String packageId,
        @JsonProperty("budget") Double budget) implements Operation {

    public static final String PAUSE_MEDIA_BUY = "pause_media_buy";
    public static final String RESUME_MEDIA_BUY = "resume_media_buy";
    public static final String PAUSE_PACKAGE = "pause_package";
    public static final String RESUME_PACKAGE = "resume_package";
    public static final String UPDATE_PACKAGE_BUDGET = "update_package_budget";
    public static final String UPDATE_PACKAGE_IMPRESSIONS = "update_package_impressions";
    public static final String ACTIVATE_ORDER = "activate_order";

    public static final Set<String> ACTIONS = Set.of(
            PAUSE_MEDIA_BUY, RESUME_MEDIA_BUY, PAUSE_PACKAGE, RESUME_PACKAGE,
            UPDATE_PACKAGE_BUDGET, UPDATE_PACKAGE_IMPRESSIONS, ACTIVATE_ORDER);

    private static final Set<String> PACKAGE_ACTIONS = Set.of(
            PAUSE_PACKAGE, RESUME_PACKAGE, UPDATE_PACKAGE_BUDGET, UPDATE_PACKAGE_IMPRESSIONS);

    private static final Set<String> BUDGET_ACTIONS = Set.of(UPDATE_PACKAGE_BUDGET, UPDATE_PACKAGE_IMPRESSIONS);

    public static UpdateMediaBuyOperation activate(String mediaBuyId) {
        return new UpdateMediaBuyOperation(mediaBuyId, ACTIVATE_ORDER, null, null);
    }

    @Override
    public OperationKind kind() {
        return OperationKind.UPDATE_MEDIA_BUY;
    }

    @Override
    public TaskAction taskAction() {
        return TaskAction.forUpdateAction(action);
    }

    public boolean targetsPackage() {
        return PACKAGE_ACTIONS.contains(action);
    }

    @Override
    public void validate() {
        if (mediaBuyId == null || mediaBuyId.isBlank()) {
            throw new IllegalArgumentException("media_buy_id is required");
        }
        if (action == null || !ACTIONS.contains(action)) {
            throw new IllegalArgumentException("unsupported action: " + action);
        }
        if (targetsPackage() && (packageId == null || packageId.isBlank())) {
            throw new IllegalArgumentException("package_id is required for " + action);
        }
        if (BUDGET_ACTIONS.contains(action) && (budget == null || budget < 0)) {
            throw new IllegalArgumentException("a non-negative budget is required for " + action);
        }
    }
}
