package adcp.workflow.operation;

import adcp.workflow.model.StepType;

import java.time.Duration;

/**
 * Operation kinds the engine can defer, with their review SLA.
 */
public enum OperationKind {
    CREATE_MEDIA_BUY("create_media_buy", Duration.ofHours(4), StepType.CREATION, CreateMediaBuyOperation.class),
    UPDATE_MEDIA_BUY("update_media_buy", Duration.ofHours(2), StepType.APPROVAL, UpdateMediaBuyOperation.class),
    ADD_CREATIVE_ASSETS("add_creative_assets", Duration.ofHours(24), StepType.APPROVAL,
            AddCreativeAssetsOperation.class);

    private final String toolName;
    private final Duration sla;
    private final StepType stepType;
    private final Class<? extends Operation> operationType;

    OperationKind(String toolName, Duration sla, StepType stepType, Class<? extends Operation> operationType) {
        this.toolName = toolName;
        this.sla = sla;
        this.stepType = stepType;
        this.operationType = operationType;
    }

    public String toolName() {
        return toolName;
    }

    public Duration sla() {
        return sla;
    }

    /** Step type of the approval task created when this kind is deferred. */
    public StepType stepType() {
        return stepType;
    }

    public Class<? extends Operation> operationType() {
        return operationType;
    }

    public static OperationKind fromToolName(String toolName) {
        for (OperationKind kind : values()) {
            if (kind.toolName.equals(toolName)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("unknown tool_name: " + toolName);
    }
}
