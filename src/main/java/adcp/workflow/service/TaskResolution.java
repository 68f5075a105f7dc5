package adcp.workflow.service;

import adcp.workflow.model.ErrorCode;
import adcp.workflow.model.Task;

/**
 * Result of {@link TaskService#completeTask}.
 *
 * @param task      the task as stored after the call, null when not found
 * @param execution what happened downstream of the resolution, null unless newly resolved
 * @param errorCode null on success; DUPLICATE_RESOLUTION is informational
 * @param message   human readable reason when errorCode is set
 */
public record TaskResolution(Task task, ExecutionOutcome execution, ErrorCode errorCode, String message) {

    public static TaskResolution resolved(Task task, ExecutionOutcome execution) {
        return new TaskResolution(task, execution, null, null);
    }

    public static TaskResolution duplicate(Task task) {
        return new TaskResolution(task, null, ErrorCode.DUPLICATE_RESOLUTION,
                "task " + task.id() + " already resolved as " + task.resolution().wireName());
    }

    public static TaskResolution error(ErrorCode code, String message) {
        return new TaskResolution(null, null, code, message);
    }

    public static TaskResolution error(ErrorCode code, String message, Task task) {
        return new TaskResolution(task, null, code, message);
    }

    /** True for a fresh resolution and for a tolerated duplicate. */
    public boolean isSuccess() {
        return errorCode == null || errorCode == ErrorCode.DUPLICATE_RESOLUTION;
    }

    public boolean isDuplicate() {
        return errorCode == ErrorCode.DUPLICATE_RESOLUTION;
    }
}
