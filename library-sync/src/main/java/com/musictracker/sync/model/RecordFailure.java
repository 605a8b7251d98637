package com.musictracker.sync.model;

public record RecordFailure(String naturalKey, String label, String error) {

    public static RecordFailure of(ExternalRecord record, Throwable cause) {
        String error = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new RecordFailure(record.naturalKey(), record.label(), error);
    }
}
