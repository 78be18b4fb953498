package com.example.rpaengine.interpreter;

import com.example.rpaengine.variables.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Terminal result of a run and the final variable snapshot. {@code message} is null on completion.
 */
public record ExecutionOutcome(ExecutionStatus status, String message, Map<String, Value> variables, long steps) {
    public ExecutionOutcome {
        Objects.requireNonNull(status, "status");
        variables = variables != null ? Collections.unmodifiableMap(new LinkedHashMap<>(variables)) : Map.of();
    }

    public boolean isCompleted() {
        return status == ExecutionStatus.COMPLETED;
    }
}
