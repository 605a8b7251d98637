package com.musictracker.sync.resilience;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Per-dependency breaker that stops calling a failing provider for a cooldown period.
 * States: CLOSED (normal) -> OPEN (tripped) -> HALF_OPEN (probing) -> CLOSED
 *
 * Callers ask {@link #allow()} before a call and report the outcome afterwards;
 * the breaker itself never throws.
 */
@Slf4j
public class CircuitBreaker {

    public enum State {
        CLOSED, OPEN, HALF_OPEN
    }

    public record Snapshot(String name, State state, int failureCount, int successCount, Instant lastFailureTime) {}

    private final String name;
    private final int failureThreshold;
    private final int successThreshold;
    private final Duration recoveryTimeout;
    private final Clock clock;

    private State state = State.CLOSED;
    private int failureCount;
    private int successCount;
    private Instant lastFailureTime;

    public CircuitBreaker(String name, int failureThreshold, int successThreshold, Duration recoveryTimeout, Clock clock) {
        if (failureThreshold < 1 || successThreshold < 1) {
            throw new IllegalArgumentException("Thresholds must be positive");
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.successThreshold = successThreshold;
        this.recoveryTimeout = recoveryTimeout;
        this.clock = clock;
    }

    /**
     * May a call proceed? The first call after the recovery timeout moves OPEN to HALF_OPEN.
     */
    public synchronized boolean allow() {
        if (state != State.OPEN) {
            return true;
        }
        if (!remainingOpenTime().isZero()) {
            return false;
        }
        state = State.HALF_OPEN;
        successCount = 0;
        log.info("Circuit breaker {} half-open, probing", name);
        return true;
    }

    public synchronized void recordSuccess() {
        switch (state) {
            case HALF_OPEN -> {
                successCount++;
                log.info("Circuit breaker {} trial call succeeded ({}/{})", name, successCount, successThreshold);
                if (successCount >= successThreshold) {
                    state = State.CLOSED;
                    failureCount = 0;
                    successCount = 0;
                    log.info("Circuit breaker {} closed", name);
                }
            }
            // only consecutive failures trip the breaker
            case CLOSED -> failureCount = 0;
            default -> { }
        }
    }

    public synchronized void recordFailure() {
        failureCount++;
        lastFailureTime = clock.instant();

        if (state == State.HALF_OPEN) {
            state = State.OPEN;
            successCount = 0;
            log.warn("Circuit breaker {} re-opened by a failed trial call", name);
        } else if (state == State.CLOSED && failureCount >= failureThreshold) {
            state = State.OPEN;
            log.warn("Circuit breaker {} opened after {} consecutive failures, cooling down for {}s",
                    name, failureCount, recoveryTimeout.toSeconds());
        }
    }

    /** Time left before an OPEN breaker lets a trial call through; zero otherwise. */
    public synchronized Duration remainingOpenTime() {
        if (state != State.OPEN || lastFailureTime == null) {
            return Duration.ZERO;
        }
        Duration elapsed = Duration.between(lastFailureTime, clock.instant());
        Duration remaining = recoveryTimeout.minus(elapsed);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public synchronized State getState() {
        return state;
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(name, state, failureCount, successCount, lastFailureTime);
    }

    public String getName() {
        return name;
    }
}
