package com.example.rpaengine.api;

import com.example.rpaengine.compiler.Diagnostic;

import java.util.List;

/**
 * Standard error response body (4xx/5xx): message, optional field errors and optional compiler diagnostics.
 */
public record ErrorResponse(String message, List<ValidationError> errors, List<Diagnostic> diagnostics) {

    public ErrorResponse(String message) {
        this(message, null, null);
    }

    public static ErrorResponse withErrors(String message, List<ValidationError> errors) {
        return new ErrorResponse(message, errors != null ? List.copyOf(errors) : null, null);
    }

    public static ErrorResponse withDiagnostics(String message, List<Diagnostic> diagnostics) {
        return new ErrorResponse(message, null, diagnostics != null ? List.copyOf(diagnostics) : null);
    }
}
