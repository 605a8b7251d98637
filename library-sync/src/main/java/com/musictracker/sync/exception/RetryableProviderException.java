package com.musictracker.sync.exception;

/**
 * Timeout, connection failure or 5xx. Worth another attempt.
 */
public class RetryableProviderException extends ProviderException {

    public RetryableProviderException(String provider, String message) {
        super(provider, message);
    }

    public RetryableProviderException(String provider, String message, Throwable cause) {
        super(provider, message, cause);
    }
}
