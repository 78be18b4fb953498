package com.example.rpaengine.api;

import lombok.Getter;

import java.util.UUID;

/**
 * Thrown when no run is registered under an id.
 * <p>
 * Mapped to HTTP 404 by {@link GlobalExceptionHandler}.
 * </p>
 */
@Getter
public class RunNotFoundException extends RuntimeException {

    private final UUID runId;

    public RunNotFoundException(UUID runId) {
        super("Run not found: " + runId);
        this.runId = runId;
    }
}
