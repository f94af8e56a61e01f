package com.jreinhal.covenant.util;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Stops calling a failing language model for a while instead of making every question wait
 * for the full timeout.
 *
 * <p>After {@code failureThreshold} consecutive failures the breaker opens for
 * {@code openDuration}; the first request after that is let through as a trial call, and its
 * outcome closes or re-opens the breaker.</p>
 */
public class ModelCircuitBreaker {
    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final int failureThreshold;
    private final Duration openDuration;
    private final Clock clock;
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private volatile long openUntilEpochMs = 0L;
    private volatile State state = State.CLOSED;
    private boolean trialInFlight;

    public ModelCircuitBreaker(int failureThreshold, Duration openDuration) {
        this(failureThreshold, openDuration, Clock.systemUTC());
    }

    public ModelCircuitBreaker(int failureThreshold, Duration openDuration, Clock clock) {
        this.failureThreshold = Math.max(1, failureThreshold);
        this.openDuration = openDuration == null ? Duration.ofSeconds(30) : openDuration;
        this.clock = clock;
    }

    public boolean allowRequest() {
        if (this.state == State.CLOSED) {
            return true;
        }
        synchronized (this) {
            if (this.state == State.OPEN) {
                if (this.clock.millis() < this.openUntilEpochMs) {
                    return false;
                }
                this.state = State.HALF_OPEN;
                this.trialInFlight = false;
            }
            if (this.state == State.HALF_OPEN && !this.trialInFlight) {
                this.trialInFlight = true;
                return true;
            }
            return this.state == State.CLOSED;
        }
    }

    public void recordSuccess() {
        this.consecutiveFailures.set(0);
        if (this.state == State.CLOSED) {
            return;
        }
        synchronized (this) {
            this.state = State.CLOSED;
            this.trialInFlight = false;
            this.openUntilEpochMs = 0L;
        }
    }

    public void recordFailure() {
        if (this.state == State.HALF_OPEN) {
            this.open();
            return;
        }
        if (this.consecutiveFailures.incrementAndGet() >= this.failureThreshold) {
            this.open();
        }
    }

    public State getState() {
        return this.state;
    }

    /**
     * Milliseconds until a trial call is allowed, 0 when not open.
     */
    public long remainingOpenMillis() {
        return this.state == State.OPEN ? Math.max(0L, this.openUntilEpochMs - this.clock.millis()) : 0L;
    }

    private synchronized void open() {
        this.state = State.OPEN;
        this.openUntilEpochMs = this.clock.millis() + this.openDuration.toMillis();
        this.consecutiveFailures.set(0);
        this.trialInFlight = false;
    }
}
