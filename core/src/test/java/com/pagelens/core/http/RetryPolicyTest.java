package com.pagelens.core.http;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void default_policy_tries_twice_and_retries_only_on_429_5xx_or_minus1() {
        var p = new DefaultRetryPolicy();

        assertEquals(2, p.maxAttempts(), "maxAttempts must be 2");

        int[] retryables = {429, 500, 502, 503, 599, -1};
        for (int sc : retryables) {
            assertTrue(p.shouldRetry(sc, 1), "should retry on first failure for " + sc);
            assertFalse(p.shouldRetry(sc, 2), "must stop retrying at attempt=2 for " + sc);
        }

        int[] nonRetry = {0, 200, 204, 301, 302, 304, 400, 401, 403, 404, 418};
        for (int sc : nonRetry) {
            assertFalse(p.shouldRetry(sc, 1), "must not retry for non-retryable code " + sc);
        }
    }

    @Test
    void backoff_is_exponential_with_jitter_plus_minus_10_percent() {
        var p = new DefaultRetryPolicy(4, 500);

        assertBetween(p.nextDelay(1).toMillis(), 450, 550, "attempt=1 backoff");
        assertBetween(p.nextDelay(2).toMillis(), 900, 1100, "attempt=2 backoff");
        assertBetween(p.nextDelay(3).toMillis(), 1800, 2200, "attempt=3 backoff");
    }

    @Test
    void invalid_arguments_are_clamped() {
        var p = new DefaultRetryPolicy(0, 0);
        assertEquals(1, p.maxAttempts());
        assertFalse(p.shouldRetry(503, 1));
        assertTrue(p.nextDelay(1).compareTo(Duration.ofMillis(2)) < 0);
    }

    // ---- helpers ----
    private static void assertBetween(long actual, long min, long max, String label) {
        assertTrue(actual >= min && actual <= max,
                () -> label + " out of range: " + actual + "ms (expected " + min + "~" + max + "ms)");
    }
}
