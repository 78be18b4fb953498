package com.example.rpaengine.interpreter;

import com.example.rpaengine.graph.LogLevel;

import java.time.Instant;

/**
 * One entry of the ordered log stream of a run. {@code activity} is the activity name of the
 * current node, or {@code EXECUTION}/{@code SYSTEM} for run-level notices.
 */
public record LogEvent(
        Instant timestamp,
        LogLevel level,
        String scenarioId,
        String nodeId,
        String activity,
        String message
) {
}
