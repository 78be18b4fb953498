package com.example.rpaengine.api;

import lombok.Getter;

/**
 * Thrown when a run names a scenario that the project does not contain. Mapped to HTTP 404.
 */
@Getter
public class ScenarioNotFoundException extends RuntimeException {

    private final String scenarioId;

    public ScenarioNotFoundException(String scenarioId) {
        super("Scenario not found: " + scenarioId);
        this.scenarioId = scenarioId;
    }
}
