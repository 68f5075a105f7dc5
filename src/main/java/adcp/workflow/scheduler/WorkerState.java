package adcp.workflow.scheduler;

/**
 * In-memory state of one background poll worker. The task row, not this, is the record of progress.
 */
public enum WorkerState {
    SCHEDULED,
    POLLING,
    TERMINAL
}
