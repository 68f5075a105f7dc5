package adcp.workflow.scheduler;

import adcp.workflow.config.WorkflowConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodic housekeeping on a single daemon thread. Jobs are registered before
 * {@link #start()} and each runs at its own fixed rate; a failed run is logged
 * and the job stays scheduled.
 * <p>
 * Background polling does not run here, it has its own pool in {@link BackgroundPollerSupervisor}.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private record Job(String name, Duration interval, Runnable task) {
    }

    private final ScheduledExecutorService executor;
    private final List<Job> jobs = new ArrayList<>();

    private volatile boolean running = false;

    public Scheduler() {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "adcp-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Scheduler running the stale execution reaper every {@code reaperInterval}.
     */
    public static Scheduler forReaper(StaleExecutionReaper reaper, WorkflowConfig config) {
        return new Scheduler().every("stale-reaper", config.reaperInterval(), reaper);
    }

    public synchronized Scheduler every(String name, Duration interval, Runnable task) {
        if (running) {
            throw new IllegalStateException("cannot add job " + name + " to a running scheduler");
        }
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval for " + name + " must be positive");
        }
        jobs.add(new Job(name, interval, task));
        return this;
    }

    public synchronized void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }
        running = true;

        for (Job job : jobs) {
            long intervalMs = job.interval().toMillis();
            executor.scheduleAtFixedRate(guarded(job), intervalMs, intervalMs, TimeUnit.MILLISECONDS);
            log.info("Scheduled {} every {}ms", job.name(), intervalMs);
        }
    }

    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
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

    public boolean isRunning() {
        return running;
    }

    public synchronized int jobCount() {
        return jobs.size();
    }

    private static Runnable guarded(Job job) {
        return () -> {
            try {
                job.task().run();
            } catch (RuntimeException e) {
                log.error("Scheduled job {} failed", job.name(), e);
            }
        };
    }
}
