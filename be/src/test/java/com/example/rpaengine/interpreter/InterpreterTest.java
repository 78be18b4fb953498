package com.example.rpaengine.interpreter;

import com.example.rpaengine.compiler.CompiledProject;
import com.example.rpaengine.compiler.ProjectCompiler;
import com.example.rpaengine.expression.DefaultExpressionEvaluator;
import com.example.rpaengine.expression.ExpressionEvaluator;
import com.example.rpaengine.graph.Activity;
import com.example.rpaengine.graph.BranchType;
import com.example.rpaengine.graph.LogLevel;
import com.example.rpaengine.graph.ParameterDirection;
import com.example.rpaengine.graph.Project;
import com.example.rpaengine.graph.Scenario;
import com.example.rpaengine.variables.Value;
import com.example.rpaengine.variables.VariableStore;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.example.rpaengine.GraphFixtures.bind;
import static com.example.rpaengine.GraphFixtures.call;
import static com.example.rpaengine.GraphFixtures.evaluate;
import static com.example.rpaengine.GraphFixtures.log;
import static com.example.rpaengine.GraphFixtures.project;
import static com.example.rpaengine.GraphFixtures.scenario;
import static com.example.rpaengine.GraphFixtures.setNumber;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Interpreter")
class InterpreterTest {

    private final ExpressionEvaluator evaluator = new DefaultExpressionEvaluator();
    private ProjectCompiler compiler;
    private Interpreter interpreter;
    private BoundedLogCollector logs;

    @BeforeEach
    void setUp() {
        compiler = new ProjectCompiler(evaluator);
        interpreter = new Interpreter(evaluator);
        logs = new BoundedLogCollector(1000);
    }

    private ExecutionOutcome run(Project project) {
        return interpreter.run(compiler.compile(project), project.mainScenarioId(), logs, new StopControl());
    }

    private static Project ifProject() {
        Scenario main = scenario("main").start().end()
                .node("if", new Activity.IfCondition("{x} > 0"))
                .node("pos", log("pos"))
                .node("neg", log("neg"))
                .connect("start", "if")
                .connect("if", "pos", BranchType.TRUE_BRANCH)
                .connect("if", "neg", BranchType.FALSE_BRANCH)
                .connect("pos", "end")
                .connect("neg", "end")
                .build();
        return project(main);
    }

    private List<String> runIf(Value x) {
        CompiledProject compiled = compiler.compile(ifProject());
        VariableStore variables = VariableStore.withSymbols(compiled.symbols());
        if (x != null) {
            variables.set("x", x);
        }
        ExecutionOutcome outcome = interpreter.run(compiled, "main", variables, logs, new StopControl());
        assertTrue(outcome.isCompleted());
        return logs.logMessages();
    }

    @Nested
    @DisplayName("sequencing and branches")
    class Branches {

        @Test
        @DisplayName("logs scenario start, node messages and scenario end in order")
        void linear() {
            Scenario main = scenario("main").start().end()
                    .node("greet", log("\"Hello, \" + \"world\""))
                    .chain("start", "greet", "end")
                    .build();
            ExecutionOutcome outcome = run(project(main));

            assertEquals(ExecutionStatus.COMPLETED, outcome.status());
            assertNull(outcome.message());
            List<LogEvent> info = logs.atLevel(LogLevel.INFO);
            assertEquals("Starting scenario: main", info.get(0).message());
            assertEquals("START", info.get(0).activity());
            assertEquals("Hello, world", info.get(1).message());
            assertEquals("greet", info.get(1).nodeId());
            assertEquals("Ending scenario: main", info.get(2).message());
        }

        @Test
        @DisplayName("If takes the True branch for x = 5")
        void ifTrue() {
            assertEquals(List.of("pos"), runIf(Value.of(5)));
        }

        @Test
        @DisplayName("If takes the False branch for x = -1")
        void ifFalse() {
            assertEquals(List.of("neg"), runIf(Value.of(-1)));
        }

        @Test
        @DisplayName("If with x unset takes the False branch")
        void ifUnset() {
            assertEquals(List.of("neg"), runIf(null));
        }

        @Test
        @DisplayName("non-boolean condition is a runtime error")
        void nonBooleanCondition() {
            Scenario main = scenario("main").start().end()
                    .node("if", new Activity.IfCondition("1 + 1"))
                    .node("a", log("a"))
                    .connect("start", "if")
                    .connect("if", "a", BranchType.TRUE_BRANCH)
                    .connect("if", "end", BranchType.FALSE_BRANCH)
                    .connect("a", "end")
                    .build();
            ExecutionOutcome outcome = run(project(main));
            assertEquals(ExecutionStatus.ERROR, outcome.status());
            assertTrue(outcome.message().startsWith("Unhandled error: Condition must evaluate to a boolean"));
        }

        @Test
        @DisplayName("unsupported activity logs a warning and continues")
        void powershellSkipped() {
            Scenario main = scenario("main").start().end()
                    .node("ps", new Activity.RunPowershell("Get-Date"))
                    .node("after", log("after"))
                    .chain("start", "ps", "after", "end")
                    .build();
            ExecutionOutcome outcome = run(project(main));
            assertTrue(outcome.isCompleted());
            assertEquals(1, logs.atLevel(LogLevel.WARNING).size());
            assertEquals(List.of("after"), logs.logMessages());
        }
    }

    @Nested
    @DisplayName("loops")
    class Loops {

        private Project counted(long start, long end, long step) {
            Scenario main = scenario("main").start().end()
                    .node("loop", new Activity.Loop("i", start, end, step))
                    .node("body", log("{i}"))
                    .connect("start", "loop")
                    .connect("loop", "body", BranchType.LOOP_BODY)
                    .connect("body", "loop")
                    .connect("loop", "end")
                    .build();
            return project(main);
        }

        @Test
        @DisplayName("counts from start towards end by step; index ends at first value past end")
        void countedLoop() {
            ExecutionOutcome outcome = run(counted(0, 10, 3));
            assertEquals(List.of("0", "3", "6", "9"), logs.logMessages());
            assertEquals(Value.of(12), outcome.variables().get("i"));
        }

        @Test
        @DisplayName("negative step counts down")
        void countdown() {
            ExecutionOutcome outcome = run(counted(5, 0, -2));
            assertEquals(List.of("5", "3", "1"), logs.logMessages());
            assertEquals(Value.of(-1), outcome.variables().get("i"));
        }

        @Test
        @DisplayName("while repeats until its condition is false and reports the iteration count")
        void whileLoop() {
            Scenario main = scenario("main").start().end()
                    .node("init", setNumber("n", "3"))
                    .node("while", new Activity.While("{n} > 0"))
                    .node("dec", evaluate("{n} - 1", "n"))
                    .chain("start", "init", "while", "end")
                    .connect("while", "dec", BranchType.LOOP_BODY)
                    .build();
            ExecutionOutcome outcome = run(project(main));
            assertEquals(Value.of(0), outcome.variables().get("n"));
            assertTrue(logs.events().stream().anyMatch(e -> e.message().equals("Completed 3 iterations")));
        }

        @Test
        @DisplayName("continue skips the rest of the body; break leaves the loop")
        void continueAndBreak() {
            Scenario main = scenario("main").start().end()
                    .node("loop", new Activity.Loop("i", 0, 10, 1))
                    .node("is2", new Activity.IfCondition("{i} == 2"))
                    .node("cont", new Activity.Continue())
                    .node("is4", new Activity.IfCondition("{i} == 4"))
                    .node("brk", new Activity.Break())
                    .node("print", log("{i}"))
                    .connect("start", "loop")
                    .connect("loop", "is2", BranchType.LOOP_BODY)
                    .connect("is2", "cont", BranchType.TRUE_BRANCH)
                    .connect("is2", "is4", BranchType.FALSE_BRANCH)
                    .connect("is4", "brk", BranchType.TRUE_BRANCH)
                    .connect("is4", "print", BranchType.FALSE_BRANCH)
                    .connect("loop", "end")
                    .build();
            ExecutionOutcome outcome = run(project(main));
            assertTrue(outcome.isCompleted());
            assertEquals(List.of("0", "1", "3"), logs.logMessages());
            assertEquals(Value.of(4), outcome.variables().get("i"));
        }

        @Test
        @DisplayName("step budget turns an endless loop into an error")
        void stepLimit() {
            interpreter = new Interpreter(evaluator, Interpreter.DEFAULT_MAX_CALL_DEPTH, 50);
            Scenario main = scenario("main").start().end()
                    .node("forever", new Activity.While("true"))
                    .node("tick", log("tick"))
                    .chain("start", "forever", "end")
                    .connect("forever", "tick", BranchType.LOOP_BODY)
                    .build();
            ExecutionOutcome outcome = run(project(main));
            assertEquals(ExecutionStatus.ERROR, outcome.status());
            assertEquals("Unhandled error: Step limit exceeded (50)", outcome.message());
            assertEquals(50, outcome.steps());
        }
    }

    @Nested
    @DisplayName("scenario calls")
    class Calls {

        private Project callProject(ParameterDirection xDirection) {
            Scenario main = scenario("main").start().end()
                    .node("set", setNumber("count", "41"))
                    .node("call", call("sub", bind("x", "count", xDirection),
                            bind("result", "answer", ParameterDirection.OUT)))
                    .chain("start", "set", "call", "end")
                    .build();
            Scenario sub = scenario("sub").start().end()
                    .param("x", xDirection)
                    .param("result", ParameterDirection.OUT)
                    .node("inc", evaluate("{x} + 1", "x"))
                    .node("copy", evaluate("{x}", "result"))
                    .chain("start", "inc", "copy", "end")
                    .build();
            return project(main, sub);
        }

        @Test
        @DisplayName("IN copies in only; OUT copies back; callee locals do not leak")
        void inAndOut() {
            ExecutionOutcome outcome = run(callProject(ParameterDirection.IN));
            assertTrue(outcome.isCompleted());
            assertEquals(Value.of(42), outcome.variables().get("answer"));
            assertEquals(Value.of(41), outcome.variables().get("count"));
            assertFalse(outcome.variables().containsKey("x"));
            assertFalse(outcome.variables().containsKey("result"));
            assertTrue(logs.events().stream().anyMatch(e -> e.message().equals("Entering scenario: sub")));
        }

        @Test
        @DisplayName("INOUT writes the callee's final value back to the caller")
        void inout() {
            ExecutionOutcome outcome = run(callProject(ParameterDirection.INOUT));
            assertEquals(Value.of(42), outcome.variables().get("count"));
            assertEquals(Value.of(42), outcome.variables().get("answer"));
        }

        @Test
        @DisplayName("same node id in caller and callee runs both nodes")
        void scopedNodeIds() {
            Scenario main = scenario("main").start().end()
                    .node("greet", log("from main"))
                    .node("call", call("sub"))
                    .chain("start", "greet", "call", "end")
                    .build();
            Scenario sub = scenario("sub").start().end()
                    .node("greet", log("from sub"))
                    .chain("start", "greet", "end")
                    .build();
            run(project(main, sub));
            assertEquals(List.of("from main", "from sub"), logs.logMessages());
        }

        @Test
        @DisplayName("unbounded recursion fails with the call depth error")
        void recursionDepth() {
            interpreter = new Interpreter(evaluator, 10, 0);
            Scenario main = scenario("main").start().end()
                    .node("call", call("rec"))
                    .chain("start", "call", "end")
                    .build();
            Scenario rec = scenario("rec").start().end()
                    .node("again", call("rec"))
                    .chain("start", "again", "end")
                    .build();
            ExecutionOutcome outcome = run(project(main, rec));
            assertEquals(ExecutionStatus.ERROR, outcome.status());
            assertEquals("Unhandled error: Maximum scenario call depth exceeded (10)", outcome.message());
        }

        @Test
        @DisplayName("a path that stops inside a called scenario ends the whole run")
        void deadEndInCallee() {
            Scenario main = scenario("main").start().end()
                    .node("call", call("sub"))
                    .node("after", log("after"))
                    .chain("start", "call", "after", "end")
                    .build();
            Scenario sub = scenario("sub").start().end()
                    .node("inside", log("inside"))
                    .connect("start", "inside")
                    .build();
            ExecutionOutcome outcome = run(project(main, sub));
            assertTrue(outcome.isCompleted());
            assertEquals(List.of("inside"), logs.logMessages());
        }

        @Test
        @DisplayName("running a scenario that is not in the project is rejected")
        void unknownScenario() {
            CompiledProject compiled = compiler.compile(callProject(ParameterDirection.IN));
            assertThrows(IllegalArgumentException.class,
                    () -> interpreter.run(compiled, "missing", logs, new StopControl()));
        }
    }

    @Nested
    @DisplayName("error handling")
    class ErrorHandling {

        @Test
        @DisplayName("error branch handles the failure and last_error holds the message")
        void errorBranch() {
            Scenario main = scenario("main").start().end()
                    .node("div", evaluate("1 / 0", "r"))
                    .node("ok", log("ok"))
                    .node("handled", log("\"handled: \" + {last_error}"))
                    .chain("start", "div", "ok", "end")
                    .connect("div", "handled", BranchType.ERROR_BRANCH)
                    .connect("handled", "end")
                    .build();
            ExecutionOutcome outcome = run(project(main));
            assertTrue(outcome.isCompleted());
            assertEquals(List.of("handled: division by zero"), logs.logMessages());
            assertEquals(Value.of("division by zero"), outcome.variables().get("last_error"));
            assertTrue(logs.events().stream().anyMatch(e -> e.message().equals("Error caught: division by zero")));
        }

        @Test
        @DisplayName("try/catch intercepts an error raised in the try region")
        void tryCatch() {
            Scenario main = scenario("main").start().end()
                    .node("try", new Activity.TryCatch())
                    .node("div", evaluate("1 / 0", "r"))
                    .node("skipped", log("skipped"))
                    .node("caught", log("caught"))
                    .node("done", log("done"))
                    .connect("start", "try")
                    .connect("try", "div", BranchType.TRY_BRANCH)
                    .connect("div", "skipped")
                    .connect("try", "caught", BranchType.CATCH_BRANCH)
                    .chain("try", "done", "end")
                    .build();
            ExecutionOutcome outcome = run(project(main));
            assertTrue(outcome.isCompleted());
            assertEquals(List.of("caught", "done"), logs.logMessages());
        }

        @Test
        @DisplayName("try/catch catches a failure in a node that was also reached before the try")
        void tryCatchSharedNode() {
            Scenario main = scenario("main").start().end()
                    .node("if", new Activity.IfCondition("false"))
                    .node("div", evaluate("1 / 0", "r"))
                    .node("try", new Activity.TryCatch())
                    .node("caught", log("caught"))
                    .connect("start", "if")
                    .connect("if", "div", BranchType.TRUE_BRANCH)
                    .connect("if", "try", BranchType.FALSE_BRANCH)
                    .connect("div", "end")
                    .connect("try", "div", BranchType.TRY_BRANCH)
                    .connect("try", "caught", BranchType.CATCH_BRANCH)
                    .connect("caught", "end")
                    .build();
            ExecutionOutcome outcome = run(project(main));
            assertTrue(outcome.isCompleted());
            assertEquals(List.of("caught"), logs.logMessages());
        }

        @Test
        @DisplayName("error in a callee unwinds to the caller's try region")
        void unwindToCaller() {
            Scenario main = scenario("main").start().end()
                    .node("try", new Activity.TryCatch())
                    .node("call", call("sub"))
                    .node("caught", log("caught {last_error}"))
                    .connect("start", "try")
                    .connect("try", "call", BranchType.TRY_BRANCH)
                    .connect("try", "caught", BranchType.CATCH_BRANCH)
                    .connect("try", "end")
                    .build();
            Scenario sub = scenario("sub").start().end()
                    .node("fail", evaluate("\"a\" * 2", null))
                    .node("unreached", log("unreached"))
                    .chain("start", "fail", "unreached", "end")
                    .build();
            ExecutionOutcome outcome = run(project(main, sub));
            assertTrue(outcome.isCompleted());
            assertEquals(1, logs.logMessages().size());
            assertTrue(logs.logMessages().get(0).startsWith("caught operator '*' expects a number"));
        }

        @Test
        @DisplayName("unhandled error ends the run with ERROR")
        void unhandled() {
            Scenario main = scenario("main").start().end()
                    .node("div", evaluate("1 / 0", "r"))
                    .chain("start", "div", "end")
                    .build();
            ExecutionOutcome outcome = run(project(main));
            assertEquals(ExecutionStatus.ERROR, outcome.status());
            assertEquals("Unhandled error: division by zero", outcome.message());
            assertEquals(1, logs.atLevel(LogLevel.ERROR).size());
        }
    }

    @Nested
    @DisplayName("cancellation")
    class Cancellation {

        private Project waiting() {
            Scenario main = scenario("main").start().end()
                    .node("wait", new Activity.Delay(60_000))
                    .node("after", log("after"))
                    .chain("start", "wait", "after", "end")
                    .build();
            return project(main);
        }

        @Test
        @DisplayName("a stop requested before the run starts cancels immediately")
        void stoppedUpFront() {
            StopControl stop = new StopControl();
            stop.requestStop();
            ExecutionOutcome outcome = interpreter.run(compiler.compile(waiting()), "main", logs, stop);
            assertEquals(ExecutionStatus.CANCELLED, outcome.status());
            assertEquals(0, outcome.steps());
        }

        @Test
        @DisplayName("a stop during a delay interrupts it")
        void stopDuringDelay() throws Exception {
            CompiledProject compiled = compiler.compile(waiting());
            StopControl stop = new StopControl();
            ExecutorService executor = Executors.newSingleThreadExecutor();
            try {
                Future<ExecutionOutcome> future = executor.submit(() -> interpreter.run(compiled, "main", logs, stop));
                TimeUnit.MILLISECONDS.sleep(200);
                stop.requestStop();
                ExecutionOutcome outcome = future.get(10, TimeUnit.SECONDS);
                assertEquals(ExecutionStatus.CANCELLED, outcome.status());
                assertEquals("Execution stopped by user", outcome.message());
                assertEquals(List.of(), logs.logMessages());
            } finally {
                executor.shutdownNow();
            }
        }
    }
}
