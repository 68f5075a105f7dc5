package adcp.workflow.webhook;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class BackoffPolicyTest {

    @Test
    void delaysGrowExponentially() {
        BackoffPolicy policy = BackoffPolicy.exponential(4, Duration.ofSeconds(1));

        assertEquals(Duration.ZERO, policy.delayBefore(1));
        assertEquals(Duration.ofSeconds(1), policy.delayBefore(2));
        assertEquals(Duration.ofSeconds(2), policy.delayBefore(3));
        assertEquals(Duration.ofSeconds(4), policy.delayBefore(4));
    }

    @Test
    void delayIsCapped() {
        BackoffPolicy policy = new BackoffPolicy(10, Duration.ofSeconds(1), 10.0, Duration.ofSeconds(30));

        assertEquals(Duration.ofSeconds(10), policy.delayBefore(3));
        assertEquals(Duration.ofSeconds(30), policy.delayBefore(4));
        assertEquals(Duration.ofSeconds(30), policy.delayBefore(9));
    }

    @Test
    void attemptsAreBounded() {
        BackoffPolicy policy = BackoffPolicy.exponential(3, Duration.ofMillis(100));

        assertTrue(policy.hasAttemptAfter(1));
        assertTrue(policy.hasAttemptAfter(2));
        assertFalse(policy.hasAttemptAfter(3));
    }

    @Test
    void rejectsNonsense() {
        assertThrows(IllegalArgumentException.class, () -> BackoffPolicy.exponential(0, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class,
                () -> new BackoffPolicy(3, Duration.ofSeconds(-1), 2.0, Duration.ofSeconds(5)));
        assertThrows(IllegalArgumentException.class,
                () -> new BackoffPolicy(3, Duration.ofSeconds(1), 0.5, Duration.ofSeconds(5)));
    }

    @Test
    void maxDelayNeverBelowInitialDelay() {
        BackoffPolicy policy = new BackoffPolicy(3, Duration.ofSeconds(5), 2.0, Duration.ofSeconds(1));

        assertEquals(Duration.ofSeconds(5), policy.maxDelay());
    }
}
