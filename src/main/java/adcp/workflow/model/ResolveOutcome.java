package adcp.workflow.model;

/**
 * Outcome of {@code TaskRepository.resolve}: the result code and the task as stored afterwards.
 */
public record ResolveOutcome(ResolveResult result, Task task) {

    public static ResolveOutcome resolved(Task task) {
        return new ResolveOutcome(ResolveResult.RESOLVED, task);
    }

    public static ResolveOutcome alreadyResolved(Task task) {
        return new ResolveOutcome(ResolveResult.ALREADY_RESOLVED, task);
    }

    public static ResolveOutcome notFound() {
        return new ResolveOutcome(ResolveResult.NOT_FOUND, null);
    }

    public boolean isResolved() {
        return result == ResolveResult.RESOLVED;
    }
}
