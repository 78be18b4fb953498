package com.example.rpaengine.api;

import java.util.Objects;

/**
 * A single request field error (field and message).
 */
public record ValidationError(String field, String message) {
    public ValidationError {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(message, "message");
    }
}
