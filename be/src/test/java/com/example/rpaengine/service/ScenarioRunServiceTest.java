package com.example.rpaengine.service;

import com.example.rpaengine.api.RunNotFoundException;
import com.example.rpaengine.api.ScenarioNotFoundException;
import com.example.rpaengine.api.v1.dto.RunResponse;
import com.example.rpaengine.compiler.ProjectCompilationException;
import com.example.rpaengine.compiler.ProjectCompiler;
import com.example.rpaengine.expression.DefaultExpressionEvaluator;
import com.example.rpaengine.graph.Activity;
import com.example.rpaengine.graph.BranchType;
import com.example.rpaengine.graph.Project;
import com.example.rpaengine.graph.Scenario;
import com.example.rpaengine.interpreter.Interpreter;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.example.rpaengine.GraphFixtures.log;
import static com.example.rpaengine.GraphFixtures.project;
import static com.example.rpaengine.GraphFixtures.scenario;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("ScenarioRunService")
class ScenarioRunServiceTest {

    private ExecutorService executor;
    private ScenarioRunService service;

    @BeforeEach
    void setUp() {
        DefaultExpressionEvaluator evaluator = new DefaultExpressionEvaluator();
        executor = Executors.newSingleThreadExecutor();
        service = new ScenarioRunService(new ProjectCompiler(evaluator), new Interpreter(evaluator), executor, 100, 2);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
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

    private static Project waiting() {
        Scenario main = scenario("main").start().end()
                .node("wait", new Activity.Delay(60_000))
                .chain("start", "wait", "end")
                .build();
        return project(main);
    }

    private static List<String> messages(RunResponse response) {
        return response.logs().stream().map(e -> e.message()).toList();
    }

    @Nested
    @DisplayName("synchronous runs")
    class Synchronous {

        @Test
        @DisplayName("inputs seed variables before the run")
        void inputs() {
            RunResponse response = service.run(ifProject(), null, Map.of("x", 5));
            assertEquals("COMPLETED", response.status());
            assertEquals("main", response.scenarioId());
            assertTrue(messages(response).contains("pos"));
            assertEquals(5.0, response.variables().get("x"));
        }

        @Test
        @DisplayName("unknown scenario id is rejected before running")
        void unknownScenario() {
            assertThrows(ScenarioNotFoundException.class, () -> service.run(ifProject(), "other", Map.of()));
        }

        @Test
        @DisplayName("compile errors surface as ProjectCompilationException")
        void compileErrors() {
            Scenario broken = scenario("main").start().connect("start", "start").build();
            assertThrows(ProjectCompilationException.class, () -> service.run(project(broken), null, Map.of()));
        }

        @Test
        @DisplayName("finished runs can be polled by id until evicted")
        void retention() {
            UUID first = service.run(ifProject(), null, Map.of()).runId();
            assertEquals("COMPLETED", service.status(first).status());
            service.run(ifProject(), null, Map.of());
            service.run(ifProject(), null, Map.of());
            assertThrows(RunNotFoundException.class, () -> service.status(first));
        }
    }

    @Nested
    @DisplayName("asynchronous runs")
    class Asynchronous {

        @Test
        @DisplayName("stop cancels a running scenario")
        void startAndStop() throws InterruptedException {
            UUID id = service.start(waiting(), null, Map.of());
            RunResponse response = service.status(id);
            for (int i = 0; i < 50 && !response.logs().stream().anyMatch(e -> e.message().startsWith("Waiting")); i++) {
                TimeUnit.MILLISECONDS.sleep(20);
                response = service.status(id);
            }
            assertEquals("RUNNING", response.status());

            service.stop(id);
            for (int i = 0; i < 250 && "RUNNING".equals(response.status()); i++) {
                TimeUnit.MILLISECONDS.sleep(20);
                response = service.status(id);
            }
            assertEquals("CANCELLED", response.status());
            assertEquals("Execution stopped by user", response.message());
        }

        @Test
        @DisplayName("unknown run id is reported")
        void unknownRun() {
            UUID id = UUID.randomUUID();
            assertThrows(RunNotFoundException.class, () -> service.status(id));
            assertThrows(RunNotFoundException.class, () -> service.stop(id));
        }
    }
}
