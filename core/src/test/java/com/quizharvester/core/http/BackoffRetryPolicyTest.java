package com.quizharvester.core.http;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class BackoffRetryPolicyTest {

    private static final Duration CAP = Duration.ofSeconds(30);

    @Test
    void shouldRetry_onlyOn_429_5xx_or_minus1_and_respect_maxAttempts_3() {
        var p = new BackoffRetryPolicy(3, Duration.ofMillis(250), CAP);

        assertEquals(3, p.maxAttempts(), "maxAttempts must be 3");

        int[] retryables = {429, 500, 502, 503, 599, -1};
        for (int sc : retryables) {
            assertTrue(p.shouldRetry(sc, 1), "should retry on first failure for " + sc);
            assertTrue(p.shouldRetry(sc, 2), "should retry on second failure for " + sc);
            assertFalse(p.shouldRetry(sc, 3), "must stop retrying at attempt=3 for " + sc);
        }

        int[] nonRetry = {200, 204, 301, 304, 400, 401, 403, 404, 418};
        for (int sc : nonRetry) {
            assertFalse(p.shouldRetry(sc, 1), "must not retry for non-retryable code " + sc);
        }
    }

    @Test
    void backoff_doubles_from_base_without_jitter() {
        var p = new BackoffRetryPolicy(5, Duration.ofMillis(250), CAP);

        assertEquals(Duration.ofMillis(250), p.delayAfter(1, Optional.empty()));
        assertEquals(Duration.ofMillis(500), p.delayAfter(2, Optional.empty()));
        assertEquals(Duration.ofMillis(1000), p.delayAfter(3, Optional.empty()));
        assertEquals(Duration.ofMillis(2000), p.delayAfter(4, Optional.empty()));
    }

    @Test
    void retryAfter_wins_only_when_longer_and_is_capped() {
        var p = new BackoffRetryPolicy(5, Duration.ofSeconds(1), CAP);

        assertEquals(Duration.ofSeconds(5), p.delayAfter(1, Optional.of(Duration.ofSeconds(5))));
        assertEquals(Duration.ofSeconds(4), p.delayAfter(3, Optional.of(Duration.ofSeconds(1))), "backoff is longer");
        assertEquals(CAP, p.delayAfter(1, Optional.of(Duration.ofMinutes(10))));
    }

    @Test
    void zeroBase_meansNoWait() {
        var p = new BackoffRetryPolicy(3, Duration.ZERO, CAP);
        assertEquals(Duration.ZERO, p.delayAfter(2, Optional.empty()));
    }

    @Test
    void parseRetryAfter_secondsOnly() {
        assertEquals(Optional.of(Duration.ofSeconds(2)), RetryPolicy.parseRetryAfter(" 2 "));
        assertEquals(Optional.empty(), RetryPolicy.parseRetryAfter("Wed, 21 Oct 2015 07:28:00 GMT"));
        assertEquals(Optional.empty(), RetryPolicy.parseRetryAfter("-1"));
        assertEquals(Optional.empty(), RetryPolicy.parseRetryAfter(null));
    }
}
