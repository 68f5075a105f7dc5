package adcp.workflow.scheduler;

import adcp.workflow.audit.AuditEntry;
import adcp.workflow.model.Task;
import adcp.workflow.model.TaskStatus;
import adcp.workflow.repository.TaskRepository;
import adcp.workflow.service.TaskFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Fails approved tasks that were left WORKING, e.g. by a crash between approval and execution.
 * <p>
 * A task qualifies once it has been WORKING longer than the threshold and no background
 * task is still polling on its behalf. Nothing is re-executed: adapter calls are not
 * idempotent, so the reviewer has to resubmit.
 */
public class StaleExecutionReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(StaleExecutionReaper.class);

    static final String STALE_DETAIL = "execution did not finish, marked failed by reaper";

    private final TaskRepository tasks;
    private final TaskFactory taskFactory;
    private final Clock clock;
    private final Duration threshold;

    public StaleExecutionReaper(TaskRepository tasks, TaskFactory taskFactory, Clock clock, Duration threshold) {
        this.tasks = tasks;
        this.taskFactory = taskFactory;
        this.clock = clock;
        this.threshold = threshold;
    }

    @Override
    public void run() {
        try {
            reapStaleExecutions();
        } catch (Exception e) {
            log.error("Stale execution reaper error", e);
        }
    }

    /**
     * @return number of tasks marked failed
     */
    public int reapStaleExecutions() {
        Instant now = clock.instant();
        List<Task> stale = tasks.findStaleExecutions(now.minus(threshold));

        if (stale.isEmpty()) {
            log.debug("No stale executions found");
            return 0;
        }

        int failed = 0;
        for (Task task : stale) {
            try {
                if (tasks.transition(task.id(), TaskStatus.WORKING, TaskStatus.FAILED, STALE_DETAIL, now)) {
                    taskFactory.audit(task, AuditEntry.TASK_STALE_EXECUTION, TaskFactory.SYSTEM_ACTOR,
                            "WORKING since " + task.resolvedAt());
                    taskFactory.notifyResolved(task.id());
                    failed++;
                    log.warn("Task {} stuck in WORKING since {}, marked failed", task.id(), task.resolvedAt());
                }
            } catch (Exception e) {
                log.error("Failed to reap task {}", task.id(), e);
            }
        }

        log.info("Stale execution reaper: {} failed, {} candidates", failed, stale.size());
        return failed;
    }
}
