package adcp.workflow.service;

/**
 * What the resumer did with a resolved task.
 */
public enum ExecutionOutcome {
    COMPLETED,
    FAILED,
    REJECTED,
    /** Adapter reported pending; a background task now polls on this task's behalf */
    DEFERRED_TO_BACKGROUND,
    /** Task was not in a state the resumer acts on */
    SKIPPED
}
