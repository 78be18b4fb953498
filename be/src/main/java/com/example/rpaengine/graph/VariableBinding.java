package com.example.rpaengine.graph;

import java.util.Objects;

/**
 * Binding of a CallScenario node: {@code targetVarName} is the callee parameter,
 * {@code sourceVarName} the caller-side variable.
 */
public record VariableBinding(String targetVarName, String sourceVarName, ParameterDirection direction) {
    public VariableBinding {
        Objects.requireNonNull(targetVarName, "targetVarName");
        Objects.requireNonNull(sourceVarName, "sourceVarName");
        direction = direction != null ? direction : ParameterDirection.IN;
    }
}
