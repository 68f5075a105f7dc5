package adcp.workflow.service;

import adcp.workflow.model.Task;

/**
 * A task as shown to reviewers, with its overdue flag computed at read time.
 */
public record TaskSummary(Task task, boolean overdue) {
}
