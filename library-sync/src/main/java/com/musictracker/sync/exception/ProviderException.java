package com.musictracker.sync.exception;

import lombok.Getter;

/**
 * Base class for failures talking to an upstream catalog or history provider.
 */
@Getter
public abstract class ProviderException extends RuntimeException {

    private final String provider;

    protected ProviderException(String provider, String message) {
        super(message);
        this.provider = provider;
    }

    protected ProviderException(String provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }
}
