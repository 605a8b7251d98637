package com.musictracker.sync.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum JobStatus {
    IDLE, STARTING, RUNNING, COMPLETED, ERROR;

    public boolean isActive() {
        return this == STARTING || this == RUNNING;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR;
    }

    @JsonValue
    public String json() {
        return name().toLowerCase(Locale.ROOT);
    }
}
