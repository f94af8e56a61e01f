package com.jreinhal.covenant.util;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ModelCircuitBreakerTest {

    private MutableClock clock;
    private ModelCircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));
        breaker = new ModelCircuitBreaker(3, Duration.ofSeconds(30), clock);
    }

    @Test
    void testOpensAfterConsecutiveFailures() {
        breaker.recordFailure();
        breaker.recordFailure();
        assertTrue(breaker.allowRequest());

        breaker.recordFailure();

        assertEquals(ModelCircuitBreaker.State.OPEN, breaker.getState());
        assertFalse(breaker.allowRequest());
        assertEquals(30_000L, breaker.remainingOpenMillis());
    }

    @Test
    void testSuccessResetsFailureCount() {
        breaker.recordFailure();
        breaker.recordFailure();
        breaker.recordSuccess();
        breaker.recordFailure();
        breaker.recordFailure();

        assertEquals(ModelCircuitBreaker.State.CLOSED, breaker.getState());
    }

    @Test
    void testSingleTrialCallAfterOpenDuration() {
        openBreaker();
        clock.advance(Duration.ofSeconds(30));

        assertTrue(breaker.allowRequest());
        assertEquals(ModelCircuitBreaker.State.HALF_OPEN, breaker.getState());
        assertFalse(breaker.allowRequest());

        breaker.recordSuccess();
        assertEquals(ModelCircuitBreaker.State.CLOSED, breaker.getState());
        assertTrue(breaker.allowRequest());
    }

    @Test
    void testFailedTrialCallReopens() {
        openBreaker();
        clock.advance(Duration.ofSeconds(31));
        assertTrue(breaker.allowRequest());

        breaker.recordFailure();

        assertEquals(ModelCircuitBreaker.State.OPEN, breaker.getState());
        assertFalse(breaker.allowRequest());
        assertEquals(30_000L, breaker.remainingOpenMillis());
    }

    private void openBreaker() {
        for (int i = 0; i < 3; i++) {
            breaker.recordFailure();
        }
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        private MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneOffset getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(java.time.ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
