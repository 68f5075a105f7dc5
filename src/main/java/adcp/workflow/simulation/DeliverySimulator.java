package adcp.workflow.simulation;

import adcp.workflow.delivery.DeliveryTarget;
import adcp.workflow.webhook.WebhookDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Produces delivery webhooks for media buys on adapters without live delivery data.
 * One simulation per media buy; each runs as a fixed-rate task on a shared scheduler.
 */
public final class DeliverySimulator {

    private static final Logger log = LoggerFactory.getLogger(DeliverySimulator.class);

    private final WebhookDispatcher dispatcher;
    private final Clock clock;
    private final double acceleration;
    private final Duration interval;
    private final ScheduledExecutorService executor;
    private final Map<String, SimulationWorker> active = new ConcurrentHashMap<>();

    public DeliverySimulator(WebhookDispatcher dispatcher, Clock clock, double acceleration, Duration interval) {
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.acceleration = acceleration;
        this.interval = interval;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "adcp-delivery-sim-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start simulating delivery for a media buy.
     *
     * @return false if a simulation for this media buy is already running
     */
    public boolean start(DeliveryTarget target) {
        DeliverySimulation simulation = new DeliverySimulation(target, acceleration, interval);
        SimulationWorker worker = new SimulationWorker(simulation);
        if (active.putIfAbsent(target.mediaBuyId(), worker) != null) {
            log.warn("Delivery simulation already running for {}", target.mediaBuyId());
            return false;
        }

        double simulatedHours = interval.toMillis() / 1000.0 * acceleration / 3600.0;
        log.info("Starting delivery simulation for {}: flight {}h, {}ms per tick = {}h simulated",
                target.mediaBuyId(), target.flightDuration().toHours(), interval.toMillis(),
                String.format("%.1f", simulatedHours));

        dispatcher.notify(simulation.start(clock.instant()));
        worker.future = executor.scheduleAtFixedRate(worker, interval.toMillis(), interval.toMillis(),
                TimeUnit.MILLISECONDS);
        return true;
    }

    public void stop(String mediaBuyId) {
        SimulationWorker worker = active.remove(mediaBuyId);
        if (worker != null) {
            worker.cancel();
            log.info("Stopped delivery simulation for {}", mediaBuyId);
        }
    }

    public boolean isRunning(String mediaBuyId) {
        return active.containsKey(mediaBuyId);
    }

    public int activeCount() {
        return active.size();
    }

    public void shutdown() {
        active.values().forEach(SimulationWorker::cancel);
        active.clear();
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Delivery simulator did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Delivery simulator stopped");
    }

    private final class SimulationWorker implements Runnable {
        private final DeliverySimulation simulation;
        private volatile ScheduledFuture<?> future;
        private volatile boolean done;

        SimulationWorker(DeliverySimulation simulation) {
            this.simulation = simulation;
        }

        @Override
        public void run() {
            if (done) {
                cancel();
                return;
            }
            String mediaBuyId = simulation.target().mediaBuyId();
            try {
                dispatcher.notify(simulation.tick(clock.instant()));
                if (simulation.isCompleted()) {
                    log.info("Delivery simulation for {} completed after {} ticks", mediaBuyId, simulation.ticks());
                    finish(mediaBuyId);
                }
            } catch (Exception e) {
                log.error("Delivery simulation for {} failed", mediaBuyId, e);
                finish(mediaBuyId);
            }
        }

        private void finish(String mediaBuyId) {
            active.remove(mediaBuyId, this);
            cancel();
        }

        void cancel() {
            done = true;
            ScheduledFuture<?> f = future;
            if (f != null) {
                f.cancel(false);
            }
        }
    }
}
