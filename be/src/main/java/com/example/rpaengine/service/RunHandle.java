package com.example.rpaengine.service;

import com.example.rpaengine.interpreter.BoundedLogCollector;
import com.example.rpaengine.interpreter.ExecutionOutcome;
import com.example.rpaengine.interpreter.StopControl;

import lombok.Getter;

import java.time.Instant;
import java.util.UUID;

/**
 * Bookkeeping for one run: its stop signal, retained log and, once finished, its outcome.
 */
@Getter
class RunHandle {

    private final UUID id;
    private final String scenarioId;
    private final Instant startedAt = Instant.now();
    private final StopControl stopControl = new StopControl();
    private final BoundedLogCollector logs;
    private volatile ExecutionOutcome outcome;

    RunHandle(UUID id, String scenarioId, int logCapacity) {
        this.id = id;
        this.scenarioId = scenarioId;
        this.logs = new BoundedLogCollector(logCapacity);
    }

    void finish(ExecutionOutcome outcome) {
        this.outcome = outcome;
    }

    boolean isFinished() {
        return outcome != null;
    }
}
