package adcp.workflow.model;

/**
 * Result of resolving a task in the store.
 */
public enum ResolveResult {
    /** This call performed the resolution */
    RESOLVED,

    /**
     * Task already carried a resolution (or was terminal) - idempotent success,
     * the stored task is returned unchanged
     */
    ALREADY_RESOLVED,

    /** Task not found */
    NOT_FOUND
}
