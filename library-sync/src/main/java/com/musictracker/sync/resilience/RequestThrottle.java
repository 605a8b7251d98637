package com.musictracker.sync.resilience;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Enforces a minimum interval between outbound requests to one provider.
 * Blocks the calling worker only; the first request goes straight through.
 */
@Slf4j
public class RequestThrottle {

    private final Duration minInterval;
    private final Clock clock;
    private final Sleeper sleeper;

    private Instant lastRequest;

    public RequestThrottle(Duration minInterval, Clock clock, Sleeper sleeper) {
        this.minInterval = minInterval;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public synchronized void acquire() {
        if (lastRequest != null) {
            Duration wait = minInterval.minus(Duration.between(lastRequest, clock.instant()));
            if (!wait.isNegative() && !wait.isZero()) {
                try {
                    sleeper.sleep(wait);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                }
            }
        }
        lastRequest = clock.instant();
    }
}
