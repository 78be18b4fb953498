package com.example.rpaengine.api.v1.dto;

import com.example.rpaengine.interpreter.LogEvent;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * State of a run. {@code status} is RUNNING until the run ends, then COMPLETED, ERROR or CANCELLED;
 * {@code variables} is filled once the run has ended.
 */
public record RunResponse(
        UUID runId,
        String scenarioId,
        String status,
        String message,
        Map<String, Object> variables,
        List<LogEvent> logs,
        long steps
) {
}
