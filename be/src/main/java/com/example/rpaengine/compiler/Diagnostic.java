package com.example.rpaengine.compiler;

import java.util.Objects;

/**
 * A compile-time finding. {@code nodeId} is null for scenario-level findings; {@code scenarioId}
 * is null for project-level ones.
 */
public record Diagnostic(Severity severity, String code, String scenarioId, String nodeId, String message) {
    public Diagnostic {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
    }

    public static Diagnostic error(String code, String scenarioId, String nodeId, String message) {
        return new Diagnostic(Severity.ERROR, code, scenarioId, nodeId, message);
    }

    public static Diagnostic warning(String code, String scenarioId, String nodeId, String message) {
        return new Diagnostic(Severity.WARNING, code, scenarioId, nodeId, message);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        String where = scenarioId == null ? "" : " [" + scenarioId + (nodeId != null ? "/" + nodeId : "") + "]";
        return code + where + " " + message;
    }
}
