package com.example.rpaengine.interpreter;

import com.example.rpaengine.compiler.CompiledProject;
import com.example.rpaengine.expression.EvaluationException;
import com.example.rpaengine.expression.Expression;
import com.example.rpaengine.expression.ExpressionEvaluator;
import com.example.rpaengine.graph.LogLevel;
import com.example.rpaengine.ir.CallTable;
import com.example.rpaengine.ir.Instruction;
import com.example.rpaengine.ir.IrProgram;
import com.example.rpaengine.ir.ResolvedBinding;
import com.example.rpaengine.ir.TryRange;
import com.example.rpaengine.variables.Value;
import com.example.rpaengine.variables.VariableStore;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Executes a {@link CompiledProject} starting at one scenario's entry address.
 * <p>
 * Single-threaded: one instruction runs to completion before the next is fetched, and the stop
 * signal is checked between instructions and during delays. Runtime errors never escape
 * {@link #run}; they are either intercepted (error branch, try range, caller's handlers) or end
 * the run with {@link ExecutionStatus#ERROR}.
 * </p>
 */
@Slf4j
public class Interpreter {

    public static final int DEFAULT_MAX_CALL_DEPTH = 100;
    public static final String LAST_ERROR = "last_error";

    private static final int HALT = -1;
    private static final int STOPPED = -2;

    private final ExpressionEvaluator evaluator;
    private final int maxCallDepth;
    private final long maxSteps;

    public Interpreter(ExpressionEvaluator evaluator) {
        this(evaluator, DEFAULT_MAX_CALL_DEPTH, 0);
    }

    /**
     * @param maxSteps instruction budget per run; 0 means unlimited
     */
    public Interpreter(ExpressionEvaluator evaluator, int maxCallDepth, long maxSteps) {
        this.evaluator = evaluator;
        this.maxCallDepth = maxCallDepth;
        this.maxSteps = maxSteps;
    }

    /**
     * Runs a scenario with a fresh store seeded from the program's symbols.
     */
    public ExecutionOutcome run(CompiledProject project, String scenarioId, ExecutionListener listener, StopControl stop) {
        return run(project, scenarioId, VariableStore.withSymbols(project.symbols()), listener, stop);
    }

    /**
     * Runs a scenario against the given store. The store must have been seeded with
     * {@link CompiledProject#symbols()} (it may hold input values set afterwards).
     *
     * @throws IllegalArgumentException if the scenario is not part of the project
     */
    public ExecutionOutcome run(CompiledProject project, String scenarioId, VariableStore variables,
                                ExecutionListener listener, StopControl stop) {
        CallTable.Entry entry = project.scenario(scenarioId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown scenario: " + scenarioId));
        List<String> symbols = project.symbols();
        for (int id = 0; id < symbols.size(); id++) {
            if (id >= variables.size() || !symbols.get(id).equals(variables.name(id))) {
                throw new IllegalArgumentException("variable store is not seeded with the program symbols");
            }
        }
        log.debug("Run start project={} scenario={} entry={}", project.projectName(), scenarioId, entry.entryAddress());
        Execution execution = new Execution(project, variables, listener != null ? listener : ExecutionListener.NONE,
                stop != null ? stop : new StopControl(), entry);
        ExecutionOutcome outcome = execution.run();
        log.debug("Run end project={} scenario={} status={} steps={}", project.projectName(), scenarioId,
                outcome.status(), outcome.steps());
        return outcome;
    }

    /**
     * Mutable state of one run.
     */
    private final class Execution {

        private final CompiledProject project;
        private final IrProgram program;
        private final VariableStore variables;
        private final ExecutionListener listener;
        private final StopControl stop;
        private final CallTable.Entry entry;
        private final CallStack callStack = new CallStack(maxCallDepth);
        private final Map<Integer, Integer> rootWhileCounters = new HashMap<>();
        private final int lastError;

        private String scenarioId;
        private String nodeId;
        private String activity = "EXECUTION";
        private long steps;

        Execution(CompiledProject project, VariableStore variables, ExecutionListener listener, StopControl stop,
                  CallTable.Entry entry) {
            this.project = project;
            this.program = project.program();
            this.variables = variables;
            this.listener = listener;
            this.stop = stop;
            this.entry = entry;
            this.scenarioId = entry.scenarioId();
            this.lastError = variables.intern(LAST_ERROR);
        }

        ExecutionOutcome run() {
            int pc = entry.entryAddress();
            for (; ; ) {
                if (stop.isStopRequested()) {
                    return cancelled();
                }
                Instruction instruction = program.get(pc);
                int next;
                try {
                    if (maxSteps > 0 && steps >= maxSteps) {
                        throw new ExecutionFault("Step limit exceeded (" + maxSteps + ")");
                    }
                    steps++;
                    next = execute(pc, instruction);
                } catch (EvaluationException | ExecutionFault e) {
                    next = handleError(pc, e.getMessage());
                    if (next == HALT) {
                        return outcome(ExecutionStatus.ERROR, "Unhandled error: " + e.getMessage());
                    }
                }
                if (next == HALT) {
                    return outcome(ExecutionStatus.COMPLETED, null);
                }
                if (next == STOPPED) {
                    return cancelled();
                }
                pc = next;
            }
        }

        private int execute(int pc, Instruction instruction) {
            if (instruction instanceof Instruction.NodeMarker m) {
                nodeId = m.nodeId();
                activity = m.activity();
                emit(LogLevel.DEBUG, "Executing node: " + m.label());
                return pc + 1;
            }
            if (instruction instanceof Instruction.ScenarioStart s) {
                scenarioId = s.scenarioId();
                if (callStack.isEmpty()) {
                    emit(LogLevel.INFO, "START", "Starting scenario: " + s.scenarioName());
                }
                return pc + 1;
            }
            if (instruction instanceof Instruction.ScenarioEnd s) {
                emit(LogLevel.INFO, "END", "Ending scenario: " + s.scenarioName());
                return pc + 1;
            }
            if (instruction instanceof Instruction.Halt) {
                return HALT;
            }
            if (instruction instanceof Instruction.Jump j) {
                return j.target();
            }
            if (instruction instanceof Instruction.JumpIfNot j) {
                boolean value = condition(j.condition());
                emit(LogLevel.DEBUG, "Condition evaluated to: " + value);
                return value ? pc + 1 : j.target();
            }
            if (instruction instanceof Instruction.SetVar s) {
                variables.set(s.variable(), s.value());
                emit(LogLevel.DEBUG, "Set variable " + s.name() + " = " + s.value().display());
                return pc + 1;
            }
            if (instruction instanceof Instruction.Log l) {
                emit(l.level(), "LOG", evaluator.evaluate(l.message(), variables).display());
                return pc + 1;
            }
            if (instruction instanceof Instruction.Delay d) {
                emit(LogLevel.INFO, "Waiting for " + d.milliseconds() + " ms");
                return stop.sleep(d.milliseconds()) ? pc + 1 : STOPPED;
            }
            if (instruction instanceof Instruction.Evaluate e) {
                Value value = evaluator.evaluate(e.expression(), variables);
                if (e.resultVariable() >= 0) {
                    variables.set(e.resultVariable(), value);
                }
                emit(LogLevel.DEBUG, "Evaluated " + e.expression().render() + " = " + value.display());
                return pc + 1;
            }
            if (instruction instanceof Instruction.LoopInit l) {
                variables.set(l.index(), Value.of((double) l.start()));
                emit(LogLevel.INFO, "Starting loop: from " + l.start() + " to " + l.end() + " step " + l.step());
                return pc + 1;
            }
            if (instruction instanceof Instruction.LoopCheck l) {
                double current = loopIndex(l.index());
                boolean more = l.step() > 0 ? current < l.end() : current > l.end();
                return more ? l.bodyTarget() : l.endTarget();
            }
            if (instruction instanceof Instruction.LoopNext l) {
                variables.set(l.index(), Value.of(loopIndex(l.index()) + l.step()));
                return l.checkTarget();
            }
            if (instruction instanceof Instruction.WhileInit w) {
                whileCounters().put(w.checkAddress(), 0);
                return pc + 1;
            }
            if (instruction instanceof Instruction.WhileCheck w) {
                Map<Integer, Integer> counters = whileCounters();
                if (condition(w.condition())) {
                    int iteration = counters.merge(pc, 1, Integer::sum);
                    emit(LogLevel.DEBUG, "Iteration " + iteration + ": condition is true");
                    return w.bodyTarget();
                }
                emit(LogLevel.INFO, "Completed " + counters.getOrDefault(pc, 0) + " iterations");
                return w.endTarget();
            }
            if (instruction instanceof Instruction.WhileNext w) {
                return w.checkTarget();
            }
            if (instruction instanceof Instruction.Call c) {
                return call(pc, c);
            }
            if (instruction instanceof Instruction.Return) {
                return ret();
            }
            if (instruction instanceof Instruction.RunPowershell) {
                emit(LogLevel.WARNING, "Run PowerShell is not supported by this engine; activity skipped");
                return pc + 1;
            }
            throw new ExecutionFault("Unsupported instruction at " + pc + ": " + instruction.describe());
        }

        private int call(int pc, Instruction.Call call) {
            CallTable.Entry callee = project.scenario(call.scenarioId())
                    .orElseThrow(() -> new ExecutionFault("Unknown scenario: " + call.scenarioId()));
            Map<Integer, Value> incoming = new LinkedHashMap<>();
            Map<Integer, Value> saved = new LinkedHashMap<>();
            for (ResolvedBinding b : call.bindings()) {
                incoming.put(b.calleeVar(), b.direction().copiesIn() ? variables.get(b.callerVar()) : Value.UNDEFINED);
                saved.putIfAbsent(b.calleeVar(), variables.get(b.calleeVar()));
            }
            callStack.push(new CallFrame(pc, scenarioId, nodeId, activity, call.bindings(), saved));
            incoming.forEach(variables::set);
            emit(LogLevel.INFO, "Entering scenario: " + callee.name());
            return call.entryAddress();
        }

        private int ret() {
            if (callStack.isEmpty()) {
                return HALT;
            }
            CallFrame frame = callStack.pop();
            List<Map.Entry<Integer, Value>> outgoing = new ArrayList<>();
            for (ResolvedBinding b : frame.bindings()) {
                if (b.direction().copiesOut()) {
                    outgoing.add(Map.entry(b.callerVar(), variables.get(b.calleeVar())));
                }
            }
            restore(frame);
            for (Map.Entry<Integer, Value> out : outgoing) {
                variables.set(out.getKey(), out.getValue());
            }
            return frame.returnAddress();
        }

        private void restore(CallFrame frame) {
            frame.savedValues().forEach(variables::set);
            scenarioId = frame.callerScenarioId();
            nodeId = frame.callerNodeId();
            activity = frame.callerActivity();
        }

        /**
         * Finds the handler for an error raised at {@code pc}: the instruction's own error branch,
         * then the innermost try range, then the same two checks at each caller's call site while
         * unwinding. Returns {@link #HALT} when nothing handles it.
         */
        private int handleError(int pc, String message) {
            variables.set(lastError, Value.of(message));
            int handler = handlerAt(pc);
            while (handler < 0 && !callStack.isEmpty()) {
                CallFrame frame = callStack.pop();
                restore(frame);
                handler = handlerAt(frame.callSite());
            }
            if (handler < 0) {
                emit(LogLevel.ERROR, "Unhandled error: " + message + ". No error handler connected.");
                return HALT;
            }
            emit(LogLevel.WARNING, "Error caught: " + message);
            return handler;
        }

        private int handlerAt(int address) {
            int target = errorTarget(program.get(address));
            if (target >= 0) {
                return target;
            }
            return project.innermostTryRange(address).map(TryRange::catchTarget).orElse(-1);
        }

        private int errorTarget(Instruction instruction) {
            if (instruction instanceof Instruction.Evaluate e) {
                return e.errorTarget();
            }
            if (instruction instanceof Instruction.Call c) {
                return c.errorTarget();
            }
            if (instruction instanceof Instruction.RunPowershell r) {
                return r.errorTarget();
            }
            return Instruction.NO_TARGET;
        }

        private boolean condition(Expression expression) {
            Value value = evaluator.evaluate(expression, variables);
            if (value instanceof Value.Bool b) {
                return b.value();
            }
            if (value instanceof Value.Undefined) {
                return false;
            }
            throw new ExecutionFault("Condition must evaluate to a boolean but was '" + value.display() + "'");
        }

        private double loopIndex(int index) {
            Value value = variables.get(index);
            if (value instanceof Value.Num n) {
                return n.value();
            }
            throw new ExecutionFault("Loop index " + variables.name(index) + " is not a number: " + value.display());
        }

        private Map<Integer, Integer> whileCounters() {
            CallFrame top = callStack.peek();
            return top != null ? top.whileCounters() : rootWhileCounters;
        }

        private ExecutionOutcome cancelled() {
            emit(LogLevel.WARNING, "EXECUTION", "Execution stopped by user");
            return outcome(ExecutionStatus.CANCELLED, "Execution stopped by user");
        }

        private ExecutionOutcome outcome(ExecutionStatus status, String message) {
            return new ExecutionOutcome(status, message, variables.snapshot(), steps);
        }

        private void emit(LogLevel level, String message) {
            emit(level, activity, message);
        }

        private void emit(LogLevel level, String activityName, String message) {
            listener.onLog(new LogEvent(Instant.now(), level, scenarioId, nodeId, activityName, message));
        }
    }
}
