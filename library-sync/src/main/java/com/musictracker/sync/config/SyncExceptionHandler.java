package com.musictracker.sync.config;

import com.musictracker.sync.exception.SyncConflictException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps sync-layer exceptions to HTTP responses.
 */
@RestControllerAdvice
@Slf4j
public class SyncExceptionHandler {

    /**
     * A job of the same kind is already running - 409 Conflict
     */
    @ExceptionHandler(SyncConflictException.class)
    public ResponseEntity<Map<String, String>> handleConflict(SyncConflictException ex) {
        return ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(Map.of("status", "conflict", "kind", ex.getKind().pathName(), "message", ex.getMessage()));
    }

    /**
     * Unknown kind or invalid parameter - 400 Bad Request
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(Map.of("error", ex.getMessage()));
    }

    /**
     * Worker pool full - 503 Service Unavailable
     */
    @ExceptionHandler(TaskRejectedException.class)
    public ResponseEntity<Map<String, String>> handleRejected(TaskRejectedException ex) {
        log.error("Sync job rejected by executor: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("error", "No worker available, try again later"));
    }
}
