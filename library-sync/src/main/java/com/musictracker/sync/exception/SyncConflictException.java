package com.musictracker.sync.exception;

import com.musictracker.sync.model.SyncKind;
import lombok.Getter;

/**
 * A job of the same kind is already starting or running.
 */
@Getter
public class SyncConflictException extends RuntimeException {

    private final SyncKind kind;

    public SyncConflictException(SyncKind kind) {
        super("A " + kind.pathName() + " sync is already running");
        this.kind = kind;
    }
}
