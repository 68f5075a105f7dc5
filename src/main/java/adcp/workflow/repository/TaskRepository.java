package adcp.workflow.repository;

import adcp.workflow.model.Resolution;
import adcp.workflow.model.ResolveOutcome;
import adcp.workflow.model.Task;
import adcp.workflow.model.TaskQuery;
import adcp.workflow.model.TaskStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Task persistence.
 * Every state change is an atomic compare-and-set; callers never read-modify-write.
 */
public interface TaskRepository {

    /**
     * Persist a new task.
     *
     * @param task the task to save
     * @return the task id
     */
    String create(Task task);

    /**
     * Find a task by ID.
     *
     * @param taskId the task ID
     * @return the task if found
     */
    Optional<Task> findById(String taskId);

    /**
     * List tasks matching a filter.
     *
     * @param query filter; null fields are unconstrained
     * @param now   reference time for the overdue filter
     * @return tasks ordered by creation time
     */
    List<Task> list(TaskQuery query, Instant now);

    /**
     * Record the single terminal resolution of a task.
     * Approving a pending task moves it to WORKING, approving a working background task
     * completes it, rejecting moves either to REJECTED.
     *
     * @return RESOLVED with the updated task, ALREADY_RESOLVED with the stored task
     *         unchanged, or NOT_FOUND
     */
    ResolveOutcome resolve(String taskId, Resolution resolution, String detail, String resolvedBy, Instant at);

    /**
     * Compare-and-set on status. Terminal targets also stamp resolved_at if not yet set.
     *
     * @param detail new resolution_detail, or null to keep the current one
     * @return true if this call performed the transition
     */
    boolean transition(String taskId, TaskStatus from, TaskStatus to, String detail, Instant at);

    /**
     * Set media_buy_id once; later calls are no-ops.
     *
     * @return true if the id was assigned by this call
     */
    boolean assignMediaBuy(String taskId, String mediaBuyId);

    /**
     * Background tasks still polling, used for recovery after restart.
     */
    List<Task> findWorkingBackgroundTasks();

    /**
     * Approval tasks approved before the cutoff that are still WORKING and have no
     * WORKING background child.
     */
    List<Task> findStaleExecutions(Instant resolvedBefore);

    List<Task> findByParentId(String parentTaskId);
}
