package io.cronhook.worker;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryPolicyTest {

    @Test
    void defaultsShouldAllowFourAttemptsWithDoublingDelay() {
        RetryPolicy policy = RetryPolicy.defaults();

        assertTrue(policy.shouldRetry(0));
        assertTrue(policy.shouldRetry(2));
        assertFalse(policy.shouldRetry(3));

        assertEquals(Duration.ofSeconds(2), policy.delayAfter(0));
        assertEquals(Duration.ofSeconds(4), policy.delayAfter(1));
        assertEquals(Duration.ofSeconds(8), policy.delayAfter(2));
    }

    @Test
    void zeroRetriesShouldNeverRetry() {
        assertFalse(new RetryPolicy(0, Duration.ofSeconds(1)).shouldRetry(0));
    }

    @Test
    void invalidArgumentsShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(-1, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(1, Duration.ofSeconds(-1)));
    }
}
