package adcp.workflow.webhook;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fire-and-forget fan-out of webhook events to registered receivers.
 * Each receiver gets up to {@link BackoffPolicy#maxAttempts()} attempts; retries are
 * scheduled, never slept, so a slow receiver does not hold a thread between attempts.
 * {@link #notify(WebhookEvent)} never blocks and never throws.
 */
public class WebhookDispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WebhookDispatcher.class);

    private final List<WebhookReceiver> receivers = new CopyOnWriteArrayList<>();
    private final BackoffPolicy backoff;
    private final ScheduledExecutorService executor;

    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    public WebhookDispatcher(BackoffPolicy backoff) {
        this(backoff, 2);
    }

    public WebhookDispatcher(BackoffPolicy backoff, int threads) {
        this.backoff = backoff;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newScheduledThreadPool(threads, r -> {
            Thread t = new Thread(r, "adcp-webhook-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public WebhookDispatcher register(WebhookReceiver receiver) {
        receivers.add(receiver);
        log.info("Registered webhook receiver: {}", receiver.name());
        return this;
    }

    public void notify(WebhookEvent event) {
        if (receivers.isEmpty()) {
            log.trace("No webhook receivers for {}", event.type().wireName());
            return;
        }
        for (WebhookReceiver receiver : receivers) {
            submit(() -> attempt(receiver, event, 1), 0);
        }
    }

    private void attempt(WebhookReceiver receiver, WebhookEvent event, int attempt) {
        try {
            receiver.deliver(event.payload());
            delivered.incrementAndGet();
            log.debug("Webhook {} for {} delivered to {} (attempt {})",
                    event.type().wireName(), event.payload().taskId(), receiver.name(), attempt);
        } catch (Exception e) {
            if (backoff.hasAttemptAfter(attempt)) {
                long delayMs = backoff.delayBefore(attempt + 1).toMillis();
                log.warn("Webhook {} to {} failed (attempt {}/{}), retrying in {}ms: {}",
                        event.type().wireName(), receiver.name(), attempt, backoff.maxAttempts(), delayMs,
                        e.getMessage());
                submit(() -> attempt(receiver, event, attempt + 1), delayMs);
            } else {
                failed.incrementAndGet();
                log.warn("Webhook {} for {} to {} dropped after {} attempts: {}",
                        event.type().wireName(), event.payload().taskId(), receiver.name(), attempt,
                        e.getMessage());
            }
        }
    }

    private void submit(Runnable task, long delayMs) {
        try {
            if (delayMs <= 0) {
                executor.execute(task);
            } else {
                executor.schedule(task, delayMs, TimeUnit.MILLISECONDS);
            }
        } catch (RejectedExecutionException e) {
            failed.incrementAndGet();
            log.debug("Webhook dispatcher is shut down, event dropped");
        }
    }

    public long deliveredCount() {
        return delivered.get();
    }

    public long failedCount() {
        return failed.get();
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Webhook dispatcher forcefully stopped");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
