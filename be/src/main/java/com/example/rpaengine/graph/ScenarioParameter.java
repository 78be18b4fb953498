package com.example.rpaengine.graph;

import java.util.Objects;

/**
 * Declared parameter of a scenario.
 */
public record ScenarioParameter(String varName, ParameterDirection direction) {
    public ScenarioParameter {
        Objects.requireNonNull(varName, "varName");
        direction = direction != null ? direction : ParameterDirection.IN;
    }
}
