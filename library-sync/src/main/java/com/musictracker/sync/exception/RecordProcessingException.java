package com.musictracker.sync.exception;

/**
 * A single record could not be transformed into a local entity.
 */
public class RecordProcessingException extends RuntimeException {

    public RecordProcessingException(String message) {
        super(message);
    }

    public RecordProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
