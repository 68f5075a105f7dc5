package adcp.workflow.model;

/**
 * Filter for listing tasks. Null fields are not constrained.
 *
 * @param tenantId          restrict to one tenant
 * @param status            restrict to one status
 * @param overdue           true = only tasks past due, false = only tasks not past due
 * @param includeBackground whether system-owned background tasks are listed
 * @param limit             maximum number of rows
 */
public record TaskQuery(
        String tenantId,
        TaskStatus status,
        Boolean overdue,
        boolean includeBackground,
        int limit) {

    public static final int DEFAULT_LIMIT = 500;

    /** Tasks a human reviewer may act on. */
    public static TaskQuery pendingForReview(String tenantId) {
        return new TaskQuery(tenantId, TaskStatus.PENDING_APPROVAL, null, false, DEFAULT_LIMIT);
    }

    public static TaskQuery all() {
        return new TaskQuery(null, null, null, true, DEFAULT_LIMIT);
    }

    public TaskQuery withOverdue(Boolean overdue) {
        return new TaskQuery(tenantId, status, overdue, includeBackground, limit);
    }
}
