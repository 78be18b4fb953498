package com.example.rpaengine.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import tools.jackson.databind.json.JsonMapper;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.example.rpaengine.GraphFixtures.log;
import static com.example.rpaengine.GraphFixtures.scenario;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Scenario graph model")
class ScenarioTest {

    @Nested
    @DisplayName("adjacency")
    class Adjacency {

        @Test
        @DisplayName("first declared connection wins for a (node, branch) pair")
        void firstConnectionWins() {
            Scenario s = scenario("main").start().end()
                    .node("a", log("a"))
                    .node("b", log("b"))
                    .connect("start", "a")
                    .connect("start", "b")
                    .connect("a", "end")
                    .connect("b", "end")
                    .build();
            assertEquals(Optional.of("a"), s.target("start", BranchType.DEFAULT));
            assertTrue(s.target("start", BranchType.TRUE_BRANCH).isEmpty());
            assertEquals(2, s.outgoing("start").size());
        }

        @Test
        @DisplayName("reachability follows every branch type and ignores orphans")
        void reachability() {
            Scenario s = scenario("main").start().end()
                    .node("if", new Activity.IfCondition("true"))
                    .node("t", log("t"))
                    .node("orphan", log("orphan"))
                    .connect("start", "if")
                    .connect("if", "t", BranchType.TRUE_BRANCH)
                    .connect("t", "end")
                    .connect("orphan", "end")
                    .build();
            assertEquals(Set.of("start", "if", "t", "end"), s.reachableFromStart());
        }

        @Test
        @DisplayName("connection id and branch default when absent")
        void connectionDefaults() {
            Connection c = new Connection(null, "a", "b", null);
            assertEquals("a->b", c.id());
            assertEquals(BranchType.DEFAULT, c.branchType());
        }
    }

    @Nested
    @DisplayName("JSON binding")
    class Json {

        @Test
        @DisplayName("activities bind by their type discriminator")
        void readsProject() {
            String json = """
                    {
                      "name": "p",
                      "mainScenarioId": "main",
                      "scenarios": [{
                        "id": "main",
                        "nodes": [
                          { "id": "start", "activity": { "type": "start" } },
                          { "id": "loop", "activity": { "type": "loop", "index": "i", "start": 0, "end": 3, "step": 1 } },
                          { "id": "call", "activity": { "type": "call_scenario", "scenarioId": "sub",
                            "parameters": [{ "targetVarName": "x", "sourceVarName": "y", "direction": "INOUT" }] } },
                          { "id": "end", "activity": { "type": "end" } }
                        ],
                        "connections": [{ "fromNode": "start", "toNode": "end" }],
                        "parameters": [{ "varName": "y", "direction": "IN" }]
                      }]
                    }
                    """;
            Project project = JsonMapper.builder().build().readValue(json, Project.class);
            Scenario main = project.mainScenario().orElseThrow();

            assertEquals("main", main.name());
            Activity.Loop loop = assertInstanceOf(Activity.Loop.class, main.node("loop").orElseThrow().activity());
            assertEquals(3, loop.end());
            Activity.CallScenario call = assertInstanceOf(Activity.CallScenario.class,
                    main.node("call").orElseThrow().activity());
            assertEquals(List.of(new VariableBinding("x", "y", ParameterDirection.INOUT)), call.parameters());
            assertEquals(ParameterDirection.IN, main.parameter("y").orElseThrow().direction());
            assertEquals(BranchType.DEFAULT, main.connections().get(0).branchType());
        }
    }
}
