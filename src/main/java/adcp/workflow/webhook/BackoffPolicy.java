package adcp.workflow.webhook;

import java.time.Duration;

/**
 * Bounded exponential backoff between delivery attempts.
 *
 * @param maxAttempts  total attempts including the first
 * @param initialDelay delay before the second attempt
 * @param multiplier   growth factor for each further attempt
 * @param maxDelay     cap on a single delay
 */
public record BackoffPolicy(int maxAttempts, Duration initialDelay, double multiplier, Duration maxDelay) {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final double DEFAULT_MULTIPLIER = 2.0;
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofMinutes(1);

    public BackoffPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must be non-negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
        if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0) {
            maxDelay = initialDelay;
        }
    }

    public static BackoffPolicy exponential(int maxAttempts, Duration initialDelay) {
        return new BackoffPolicy(maxAttempts, initialDelay, DEFAULT_MULTIPLIER,
                initialDelay.compareTo(DEFAULT_MAX_DELAY) > 0 ? initialDelay : DEFAULT_MAX_DELAY);
    }

    public boolean hasAttemptAfter(int attempt) {
        return attempt < maxAttempts;
    }

    /**
     * Delay before the given attempt (2 = first retry).
     */
    public Duration delayBefore(int attempt) {
        if (attempt <= 1) {
            return Duration.ZERO;
        }
        double millis = initialDelay.toMillis() * Math.pow(multiplier, attempt - 2);
        long capped = (long) Math.min(millis, maxDelay.toMillis());
        return Duration.ofMillis(capped);
    }
}
