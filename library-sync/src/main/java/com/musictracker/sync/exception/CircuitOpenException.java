package com.musictracker.sync.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * Raised instead of calling a dependency whose circuit breaker is open.
 */
@Getter
public class CircuitOpenException extends ProviderException {

    private final Duration retryAfter;

    public CircuitOpenException(String provider, Duration retryAfter) {
        super(provider, "Circuit breaker open for " + provider + ", retry after " + retryAfter.toSeconds() + "s");
        this.retryAfter = retryAfter;
    }
}
