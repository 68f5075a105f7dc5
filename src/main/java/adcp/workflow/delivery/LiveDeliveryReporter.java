package adcp.workflow.delivery;

import adcp.workflow.adapter.AdServerAdapter;
import adcp.workflow.adapter.AdapterException;
import adcp.workflow.adapter.DateRange;
import adcp.workflow.adapter.DeliveryReport;
import adcp.workflow.webhook.DeliveryUpdate;
import adcp.workflow.webhook.WebhookDispatcher;
import adcp.workflow.webhook.WebhookEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodically pulls real delivery from adapters that report it and emits the same
 * delivering / completed webhooks the simulator produces.
 */
public class LiveDeliveryReporter {

    private static final Logger log = LoggerFactory.getLogger(LiveDeliveryReporter.class);

    private final WebhookDispatcher dispatcher;
    private final Clock clock;
    private final Duration interval;
    private final ScheduledExecutorService executor;
    private final Map<String, ReportWorker> reports = new ConcurrentHashMap<>();

    public LiveDeliveryReporter(WebhookDispatcher dispatcher, Clock clock, Duration interval) {
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.interval = interval;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "adcp-delivery-reporter");
            t.setDaemon(true);
            return t;
        });
    }

    public boolean start(AdServerAdapter adapter, DeliveryTarget target) {
        ReportWorker worker = new ReportWorker(adapter, target);
        if (reports.putIfAbsent(target.mediaBuyId(), worker) != null) {
            return false;
        }
        worker.future = executor.scheduleAtFixedRate(worker, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Live delivery reporting started for {} every {}", target.mediaBuyId(), interval);
        return true;
    }

    /**
     * Fetch and emit one report.
     *
     * @return true when reporting has stopped, because the flight is over or the platform refused permanently
     */
    boolean report(AdServerAdapter adapter, DeliveryTarget target) {
        Instant now = clock.instant();
        try {
            Instant until = now.isBefore(target.flightEnd()) ? now : target.flightEnd();
            if (until.isBefore(target.flightStart())) {
                until = target.flightStart();
            }
            DeliveryReport report = adapter.getMediaBuyDelivery(target.mediaBuyId(),
                    new DateRange(target.flightStart(), until), now);

            double total = target.flightDuration().toSeconds();
            double elapsed = Duration.between(target.flightStart(), until).toSeconds();
            boolean finished = !now.isBefore(target.flightEnd());

            DeliveryUpdate update = DeliveryUpdate.snapshot(target.mediaBuyId(), elapsed, total,
                    report.impressions(), report.spend(), target.totalBudget());
            dispatcher.notify(WebhookEvent.delivery(target.mediaBuyId(), finished ? "completed" : "delivering",
                    update, now));

            if (finished) {
                stop(target.mediaBuyId());
            }
            return finished;
        } catch (AdapterException e) {
            boolean giveUp = !e.isTransient() || !now.isBefore(target.flightEnd());
            if (giveUp) {
                log.warn("Delivery reporting for {} abandoned ({}): {}", target.mediaBuyId(), e.kind().wireName(),
                        e.getMessage());
                stop(target.mediaBuyId());
                return true;
            }
            // transient, next tick retries
            log.warn("Delivery report for {} failed ({}): {}", target.mediaBuyId(), e.kind().wireName(),
                    e.getMessage());
            return false;
        } catch (Exception e) {
            log.error("Delivery reporter error for {}", target.mediaBuyId(), e);
            return false;
        }
    }

    public void stop(String mediaBuyId) {
        ReportWorker worker = reports.remove(mediaBuyId);
        if (worker != null) {
            worker.cancel();
            log.info("Live delivery reporting stopped for {}", mediaBuyId);
        }
    }

    public boolean isReporting(String mediaBuyId) {
        return reports.containsKey(mediaBuyId);
    }

    public void shutdown() {
        reports.values().forEach(ReportWorker::cancel);
        reports.clear();
        executor.shutdownNow();
    }

    private final class ReportWorker implements Runnable {
        private final AdServerAdapter adapter;
        private final DeliveryTarget target;
        private volatile ScheduledFuture<?> future;
        private volatile boolean done;

        ReportWorker(AdServerAdapter adapter, DeliveryTarget target) {
            this.adapter = adapter;
            this.target = target;
        }

        @Override
        public void run() {
            if (done) {
                cancel();
                return;
            }
            report(adapter, target);
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
