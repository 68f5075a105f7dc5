package adcp.workflow.scheduler;

import adcp.workflow.delivery.DeliveryTracking;
import adcp.workflow.model.Task;
import adcp.workflow.model.TaskStatus;
import adcp.workflow.operation.RequestContextCodec;
import adcp.workflow.repository.TaskRepository;
import adcp.workflow.service.ExecutionLocks;
import adcp.workflow.service.PolicyResolver;
import adcp.workflow.service.TaskFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns one {@link BackgroundPollWorker} per WORKING background task.
 * <p>
 * Workers share a small scheduled pool and are keyed by task id, so spawning a task that is
 * already polled is a no-op. {@link #recover()} re-attaches workers after a restart.
 */
public class BackgroundPollerSupervisor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BackgroundPollerSupervisor.class);

    private final PollingContext ctx;
    private final Duration pollInterval;
    private final ScheduledExecutorService executor;
    private final Map<String, BackgroundPollWorker> workers = new ConcurrentHashMap<>();

    private volatile boolean stopped = false;

    public BackgroundPollerSupervisor(TaskRepository tasks, PolicyResolver policyResolver, ExecutionLocks locks,
            TaskFactory taskFactory, RequestContextCodec codec, DeliveryTracking deliveryTracking, Clock clock,
            Duration pollInterval, Duration maxPolling, int threads) {
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        this.ctx = new PollingContext(tasks, policyResolver, locks, taskFactory, codec, deliveryTracking, clock,
                maxPolling);
        this.pollInterval = pollInterval;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newScheduledThreadPool(threads, r -> {
            Thread t = new Thread(r, "adcp-poller-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start polling a background task.
     *
     * @return false if the task is not a WORKING background task or is already being polled
     */
    public boolean spawn(Task task) {
        if (!task.isBackground() || task.status() != TaskStatus.WORKING) {
            log.debug("Not spawning poller for {} ({}, {})", task.id(), task.stepType(), task.status());
            return false;
        }
        if (stopped) {
            log.warn("Supervisor stopped, not polling task {}", task.id());
            return false;
        }

        BackgroundPollWorker worker = new BackgroundPollWorker(task.id(), ctx, this::onTerminal);
        if (workers.putIfAbsent(task.id(), worker) != null) {
            log.debug("Task {} is already being polled", task.id());
            return false;
        }

        try {
            long intervalMs = pollInterval.toMillis();
            worker.attach(executor.scheduleWithFixedDelay(worker, intervalMs, intervalMs, TimeUnit.MILLISECONDS));
        } catch (RejectedExecutionException e) {
            workers.remove(task.id(), worker);
            log.warn("Poller pool rejected task {}", task.id());
            return false;
        }
        log.info("Polling media buy {} every {} for task {}", task.mediaBuyId(), pollInterval, task.id());
        return true;
    }

    /**
     * Stop polling a task, e.g. after a reviewer rejected it. The task row is not touched.
     */
    public void cancel(String taskId) {
        BackgroundPollWorker worker = workers.remove(taskId);
        if (worker != null) {
            worker.cancel();
            log.info("Cancelled poller for task {}", taskId);
        }
    }

    /**
     * Re-attach a worker to every background task still WORKING in storage.
     *
     * @return number of workers spawned
     */
    public int recover() {
        List<Task> working = ctx.tasks().findWorkingBackgroundTasks();
        int spawned = 0;
        for (Task task : working) {
            try {
                if (spawn(task)) {
                    spawned++;
                }
            } catch (Exception e) {
                log.error("Failed to recover poller for task {}", task.id(), e);
            }
        }
        log.info("Poller recovery: {} of {} working background tasks re-attached", spawned, working.size());
        return spawned;
    }

    public boolean isPolling(String taskId) {
        return workers.containsKey(taskId);
    }

    public int activeCount() {
        return workers.size();
    }

    public void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        workers.values().forEach(BackgroundPollWorker::cancel);
        workers.clear();
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Poller pool forcefully stopped");
            } else {
                log.info("Poller pool stopped");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    private void onTerminal(BackgroundPollWorker worker) {
        workers.remove(worker.taskId(), worker);
    }
}
