package com.example.rpaengine.api.v1.dto;

import com.example.rpaengine.graph.Project;

import jakarta.validation.constraints.NotNull;

import java.util.Map;

/**
 * Request body for a run. {@code scenarioId} defaults to the project's main scenario;
 * {@code inputs} are initial variable values (strings, booleans, numbers).
 */
public record RunRequest(
        @NotNull(message = "project is required") Project project,
        String scenarioId,
        Map<String, Object> inputs
) {
    public RunRequest {
        inputs = inputs != null ? inputs : Map.of();
    }
}
