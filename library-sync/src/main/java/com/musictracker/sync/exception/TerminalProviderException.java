package com.musictracker.sync.exception;

import lombok.Getter;

/**
 * 4xx or validation failure. Retrying cannot help.
 */
@Getter
public class TerminalProviderException extends ProviderException {

    private final int statusCode;

    public TerminalProviderException(String provider, int statusCode, String message) {
        super(provider, message);
        this.statusCode = statusCode;
    }

    public TerminalProviderException(String provider, int statusCode, String message, Throwable cause) {
        super(provider, message, cause);
        this.statusCode = statusCode;
    }

    /** Bad or revoked credentials: every later call would fail the same way. */
    public boolean isCredentialFailure() {
        return statusCode == 401 || statusCode == 403;
    }
}
