package adcp.workflow.model;

import java.util.Locale;

/**
 * Kind of workflow step a task represents.
 */
public enum StepType {
    APPROVAL,
    CREATION,
    BACKGROUND_TASK;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
