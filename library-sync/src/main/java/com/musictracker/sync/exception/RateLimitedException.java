package com.musictracker.sync.exception;

/**
 * The provider answered "too many requests". Never retried straight away.
 */
public class RateLimitedException extends ProviderException {

    public RateLimitedException(String provider, String message) {
        super(provider, message);
    }
}
