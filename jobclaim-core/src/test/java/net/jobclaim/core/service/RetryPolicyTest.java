package net.jobclaim.core.service;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void jitter_staysWithinTheExponentialCeiling() {
        RetryPolicy p = RetryPolicy.exponentialJitter(Duration.ofMillis(10), Duration.ofMillis(50));
        for (int i = 0; i < 200; i++) {
            assertTrue(p.nextBackoff(1).toMillis() <= 10);
            assertTrue(p.nextBackoff(2).toMillis() <= 20);
            assertTrue(p.nextBackoff(3).toMillis() <= 40);
            assertTrue(p.nextBackoff(10).toMillis() <= 50);
            assertFalse(p.nextBackoff(64).isNegative());
        }
    }

    @Test
    void zeroBase_meansNoPause() {
        assertEquals(Duration.ZERO, RetryPolicy.exponentialJitter(Duration.ZERO, Duration.ofSeconds(1)).nextBackoff(5));
    }

    @Test
    void fixed_ignoresAttempt() {
        RetryPolicy p = RetryPolicy.fixed(Duration.ofMillis(7));
        assertEquals(Duration.ofMillis(7), p.nextBackoff(1));
        assertEquals(Duration.ofMillis(7), p.nextBackoff(99));
    }
}
