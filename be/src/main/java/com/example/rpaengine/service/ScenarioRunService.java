package com.example.rpaengine.service;

import com.example.rpaengine.api.RunNotFoundException;
import com.example.rpaengine.api.ScenarioNotFoundException;
import com.example.rpaengine.api.v1.dto.RunResponse;
import com.example.rpaengine.compiler.CompiledProject;
import com.example.rpaengine.compiler.ProjectCompilationException;
import com.example.rpaengine.compiler.ProjectCompiler;
import com.example.rpaengine.graph.Project;
import com.example.rpaengine.graph.Scenario;
import com.example.rpaengine.interpreter.ExecutionOutcome;
import com.example.rpaengine.interpreter.ExecutionStatus;
import com.example.rpaengine.interpreter.Interpreter;
import com.example.rpaengine.variables.Value;
import com.example.rpaengine.variables.VariableStore;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Compiles projects and runs scenarios, synchronously or on the run executor.
 * <p>
 * Every run is registered under a fresh id so its state can be polled and an asynchronous run stopped.
 * Only the most recent finished runs are retained.
 * </p>
 */
@Service
@Slf4j
public class ScenarioRunService {

    private final ProjectCompiler compiler;
    private final Interpreter interpreter;
    private final ExecutorService runExecutor;
    private final int logCapacity;
    private final int maxRetainedRuns;
    private final Map<UUID, RunHandle> runs = new ConcurrentHashMap<>();

    public ScenarioRunService(
            ProjectCompiler compiler,
            Interpreter interpreter,
            ExecutorService runExecutor,
            @org.springframework.beans.factory.annotation.Value("${rpa.engine.log-capacity:100}") int logCapacity,
            @org.springframework.beans.factory.annotation.Value("${rpa.engine.max-retained-runs:100}") int maxRetainedRuns) {
        this.compiler = compiler;
        this.interpreter = interpreter;
        this.runExecutor = runExecutor;
        this.logCapacity = logCapacity;
        this.maxRetainedRuns = Math.max(1, maxRetainedRuns);
    }

    /**
     * @throws ProjectCompilationException if the project has compile-time errors
     */
    public CompiledProject compile(Project project) {
        log.info("Compiling project name={} scenarios={}", project.name(), project.scenarios().size());
        CompiledProject compiled = compiler.compile(project);
        log.info("Compiled project name={} instructions={} warnings={}", project.name(),
                compiled.program().size(), compiled.warnings().size());
        return compiled;
    }

    /**
     * Compiles and runs to completion on the calling thread.
     *
     * @throws ProjectCompilationException if the project has compile-time errors
     * @throws ScenarioNotFoundException   if the scenario is not part of the project
     * @throws IllegalArgumentException    if an input value is not a string, boolean or number
     */
    public RunResponse run(Project project, String scenarioId, Map<String, Object> inputs) {
        CompiledProject compiled = compile(project);
        RunHandle handle = register(resolveScenario(project, scenarioId));
        VariableStore variables = seed(compiled, inputs);
        execute(compiled, handle, variables);
        return toResponse(handle);
    }

    /**
     * Compiles on the calling thread, then runs on the run executor. Returns the run id immediately.
     */
    public UUID start(Project project, String scenarioId, Map<String, Object> inputs) {
        CompiledProject compiled = compile(project);
        RunHandle handle = register(resolveScenario(project, scenarioId));
        VariableStore variables = seed(compiled, inputs);
        runExecutor.submit(() -> execute(compiled, handle, variables));
        log.info("Started run id={} scenario={}", handle.getId(), handle.getScenarioId());
        return handle.getId();
    }

    public RunResponse status(UUID runId) {
        return toResponse(handle(runId));
    }

    /**
     * Requests cancellation. A finished run is left as is.
     */
    public RunResponse stop(UUID runId) {
        RunHandle handle = handle(runId);
        if (!handle.isFinished()) {
            log.info("Stop requested for run id={}", runId);
            handle.getStopControl().requestStop();
        }
        return toResponse(handle);
    }

    private void execute(CompiledProject compiled, RunHandle handle, VariableStore variables) {
        log.info("Run start id={} project={} scenario={}", handle.getId(), compiled.projectName(), handle.getScenarioId());
        ExecutionOutcome outcome;
        try {
            outcome = interpreter.run(compiled, handle.getScenarioId(), variables, handle.getLogs(), handle.getStopControl());
        } catch (RuntimeException e) {
            log.error("Run failed id={}: {}", handle.getId(), e.getMessage(), e);
            outcome = new ExecutionOutcome(ExecutionStatus.ERROR, "Internal error: " + e.getMessage(), variables.snapshot(), 0);
        }
        handle.finish(outcome);
        log.info("Run finished id={} status={} steps={} message={}", handle.getId(), outcome.status(), outcome.steps(),
                outcome.message());
    }

    private String resolveScenario(Project project, String scenarioId) {
        if (scenarioId == null || scenarioId.isBlank()) {
            return project.mainScenario().map(Scenario::id)
                    .orElseThrow(() -> new IllegalArgumentException("project has no scenarios"));
        }
        return project.scenario(scenarioId).map(Scenario::id)
                .orElseThrow(() -> new ScenarioNotFoundException(scenarioId));
    }

    private static VariableStore seed(CompiledProject compiled, Map<String, Object> inputs) {
        VariableStore variables = VariableStore.withSymbols(compiled.symbols());
        if (inputs != null) {
            inputs.forEach((name, value) -> variables.set(name, Value.fromObject(value)));
        }
        return variables;
    }

    private RunHandle register(String scenarioId) {
        RunHandle handle = new RunHandle(UUID.randomUUID(), scenarioId, logCapacity);
        runs.put(handle.getId(), handle);
        evictFinished();
        return handle;
    }

    private void evictFinished() {
        while (runs.size() > maxRetainedRuns) {
            UUID oldest = runs.values().stream()
                    .filter(RunHandle::isFinished)
                    .min(Comparator.comparing(RunHandle::getStartedAt))
                    .map(RunHandle::getId)
                    .orElse(null);
            if (oldest == null) {
                return;
            }
            runs.remove(oldest);
        }
    }

    private RunHandle handle(UUID runId) {
        RunHandle handle = runs.get(runId);
        if (handle == null) {
            throw new RunNotFoundException(runId);
        }
        return handle;
    }

    private static RunResponse toResponse(RunHandle handle) {
        ExecutionOutcome outcome = handle.getOutcome();
        Map<String, Object> variables = new LinkedHashMap<>();
        if (outcome == null) {
            return new RunResponse(handle.getId(), handle.getScenarioId(), "RUNNING", null, variables,
                    handle.getLogs().events(), 0);
        }
        for (Entry<String, Value> e : outcome.variables().entrySet()) {
            variables.put(e.getKey(), e.getValue().toObject());
        }
        return new RunResponse(handle.getId(), handle.getScenarioId(), outcome.status().name(), outcome.message(),
                variables, handle.getLogs().events(), outcome.steps());
    }
}
