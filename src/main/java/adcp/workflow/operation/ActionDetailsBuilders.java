package adcp.workflow.operation;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

/**
 * Dispatch table from operation kind to a pure action-details builder.
 * The interceptor only calls {@link #forOperation}; each builder is also usable on its own.
 */
public final class ActionDetailsBuilders {

    public static final String ACTION_CREATE_MEDIA_BUY = "create_media_buy";
    public static final String ACTION_ACTIVATE_ORDER = "activate_order";
    public static final String ACTION_UPDATE_MEDIA_BUY = "update_media_buy";
    public static final String ACTION_CREATIVE_APPROVAL = "creative_approval";
    public static final String ACTION_BACKGROUND_APPROVAL = "background_approval_polling";

    private static final Map<OperationKind, BiFunction<Operation, String, ActionDetails>> BUILDERS =
            new EnumMap<>(OperationKind.class);

    static {
        BUILDERS.put(OperationKind.CREATE_MEDIA_BUY,
                (op, platform) -> creation((CreateMediaBuyOperation) op, platform));
        BUILDERS.put(OperationKind.UPDATE_MEDIA_BUY,
                (op, platform) -> activation((UpdateMediaBuyOperation) op, platform));
        BUILDERS.put(OperationKind.ADD_CREATIVE_ASSETS,
                (op, platform) -> approval((AddCreativeAssetsOperation) op, platform));
    }

    private ActionDetailsBuilders() {
    }

    public static ActionDetails forOperation(Operation operation, String platform) {
        BiFunction<Operation, String, ActionDetails> builder = BUILDERS.get(operation.kind());
        if (builder == null) {
            throw new IllegalArgumentException("no action details builder for " + operation.kind());
        }
        return builder.apply(operation, platform);
    }

    /**
     * Manual creation of a new order in the publisher's ad server.
     */
    public static ActionDetails creation(CreateMediaBuyOperation op, String platform) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("campaign_name", campaignName(op));
        attrs.put("po_number", op.poNumber());
        attrs.put("total_budget", op.budget());
        attrs.put("currency", op.currency() == null ? "USD" : op.currency());
        attrs.put("flight_start", String.valueOf(op.flightStart()));
        attrs.put("flight_end", String.valueOf(op.flightEnd()));

        List<Map<String, Object>> packages = new ArrayList<>();
        for (MediaPackage pkg : op.packages()) {
            Map<String, Object> p = new LinkedHashMap<>();
            p.put("package_id", pkg.packageId());
            p.put("name", pkg.name());
            p.put("impressions", pkg.impressions());
            p.put("cpm", pkg.cpm());
            p.put("budget", pkg.effectiveBudget());
            packages.add(p);
        }
        attrs.put("packages", packages);

        List<String> instructions = List.of(
                "Review the campaign details and budget allocation",
                "Create the order in " + platform + " with the listed line items",
                "Verify flight dates " + op.flightStart() + " to " + op.flightEnd(),
                "Approve this task once the order exists so the media buy can be recorded");

        return new ActionDetails(ACTION_CREATE_MEDIA_BUY, null, platform, ActionDetails.MODE_MANUAL,
                instructions, attrs);
    }

    /**
     * Confirmation of an update action, most commonly activating an order.
     */
    public static ActionDetails activation(UpdateMediaBuyOperation op, String platform) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("action", op.action());
        if (op.packageId() != null) {
            attrs.put("package_id", op.packageId());
        }
        if (op.budget() != null) {
            attrs.put("budget", op.budget());
        }

        List<String> instructions;
        String actionType;
        if (UpdateMediaBuyOperation.ACTIVATE_ORDER.equals(op.action())) {
            actionType = ACTION_ACTIVATE_ORDER;
            instructions = List.of(
                    "Review order " + op.mediaBuyId() + " in " + platform,
                    "Verify line items, targeting and creative assignments",
                    "Approve to activate the order and start delivery");
        } else {
            actionType = ACTION_UPDATE_MEDIA_BUY;
            instructions = List.of(
                    "Review the requested change: " + op.action()
                            + (op.packageId() != null ? " on package " + op.packageId() : ""),
                    "Approve to apply it to media buy " + op.mediaBuyId() + " in " + platform);
        }
        return new ActionDetails(actionType, op.mediaBuyId(), platform, ActionDetails.MODE_CONFIRMATION_REQUIRED,
                instructions, attrs);
    }

    /**
     * Creative approval before assets are attached to a media buy.
     */
    public static ActionDetails approval(AddCreativeAssetsOperation op, String platform) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("creative_ids", op.assets().stream().map(CreativeAsset::creativeId).toList());
        attrs.put("asset_count", op.assets().size());

        List<String> instructions = List.of(
                "Review each creative for brand safety and format compliance",
                "Check package assignments for media buy " + op.mediaBuyId(),
                "Approve to upload the creatives to " + platform);

        return new ActionDetails(ACTION_CREATIVE_APPROVAL, op.mediaBuyId(), platform,
                ActionDetails.MODE_CONFIRMATION_REQUIRED, instructions, attrs);
    }

    /**
     * Automatic polling of the platform until it finishes processing the media buy.
     */
    public static ActionDetails backgroundPolling(String mediaBuyId, Operation original, String platform,
            Duration pollInterval, Duration maxDuration) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("original_tool", original.kind().toolName());
        attrs.put("polling_interval_seconds", pollInterval.toSeconds());
        attrs.put("max_polling_duration_minutes", maxDuration.toMinutes());

        List<String> instructions = List.of(
                "Waiting for " + platform + " to finish processing media buy " + mediaBuyId,
                "No action needed; a new approval task is created if polling times out");

        return new ActionDetails(ACTION_BACKGROUND_APPROVAL, mediaBuyId, platform,
                ActionDetails.MODE_BACKGROUND_POLLING, instructions, attrs);
    }

    private static String campaignName(CreateMediaBuyOperation op) {
        if (op.promotedOffering() != null && !op.promotedOffering().isBlank()) {
            return op.promotedOffering();
        }
        return op.buyerRef() != null ? op.buyerRef() : "unnamed campaign";
    }
}
