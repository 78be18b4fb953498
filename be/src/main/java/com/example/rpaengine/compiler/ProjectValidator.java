package com.example.rpaengine.compiler;

import com.example.rpaengine.expression.Expression;
import com.example.rpaengine.expression.ExpressionEvaluator;
import com.example.rpaengine.expression.ExpressionParseException;
import com.example.rpaengine.graph.Activity;
import com.example.rpaengine.graph.BranchType;
import com.example.rpaengine.graph.Connection;
import com.example.rpaengine.graph.Node;
import com.example.rpaengine.graph.Project;
import com.example.rpaengine.graph.Scenario;
import com.example.rpaengine.graph.ScenarioParameter;
import com.example.rpaengine.graph.VariableBinding;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Structural checks on a project before code generation: start/end presence, connection
 * integrity, loop parameters, expression syntax, call targets, branch coverage and recursion.
 * <p>
 * Only nodes reachable from a scenario's Start are examined, so dead code never produces
 * diagnostics. Codes starting with {@code E} are errors and block compilation; {@code W} codes
 * are warnings.
 * </p>
 */
public final class ProjectValidator {

    static final String LAST_ERROR = "last_error";

    private ProjectValidator() {
    }

    /**
     * Returns every diagnostic found, errors and warnings, in scenario declaration order.
     */
    public static List<Diagnostic> validate(Project project, ExpressionEvaluator evaluator) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        Set<String> scenarioIds = new HashSet<>();
        for (Scenario scenario : project.scenarios()) {
            if (!scenarioIds.add(scenario.id())) {
                diagnostics.add(Diagnostic.error("E005", scenario.id(), null,
                        "Duplicate scenario id '" + scenario.id() + "'"));
            }
        }
        for (Scenario scenario : project.scenarios()) {
            validateScenario(project, scenario, evaluator, diagnostics);
        }
        for (List<String> cycle : CallGraph.of(project).cycles()) {
            diagnostics.add(Diagnostic.warning("W006", cycle.get(0), null,
                    "Recursive scenario call detected: " + String.join(" -> ", cycle)));
        }
        return diagnostics;
    }

    private static void validateScenario(Project project, Scenario scenario, ExpressionEvaluator evaluator,
                                         List<Diagnostic> out) {
        String sid = scenario.id();
        Set<String> reachable = scenario.reachableFromStart();
        Set<String> nodeIds = new HashSet<>();
        for (Node node : scenario.nodes()) {
            if (!nodeIds.add(node.id()) && reachable.contains(node.id())) {
                out.add(Diagnostic.error("E006", sid, node.id(), "Duplicate node id '" + node.id() + "'"));
            }
        }
        if (scenario.startNode().isEmpty()) {
            out.add(Diagnostic.error("E001", sid, null, "Scenario '" + scenario.name() + "' has no Start node"));
        }
        if (scenario.endNodes().isEmpty()) {
            out.add(Diagnostic.error("E002", sid, null, "Scenario '" + scenario.name() + "' has no End node"));
        }
        for (Connection c : scenario.connections()) {
            if (reachable.contains(c.fromNode()) && !nodeIds.contains(c.toNode())) {
                out.add(Diagnostic.error("E004", sid, c.fromNode(),
                        "Connection " + c.id() + " points to non-existent node '" + c.toNode() + "'"));
            }
        }

        Set<String> defined = new HashSet<>();
        Set<String> used = new LinkedHashSet<>();
        Map<String, String> firstUse = new HashMap<>();
        defined.add(LAST_ERROR);
        scenario.parameters().stream().map(ScenarioParameter::varName).forEach(defined::add);

        for (String nodeId : reachable) {
            Node node = scenario.node(nodeId).orElseThrow();
            Activity activity = node.activity();
            if (activity instanceof Activity.IfCondition a) {
                parse(a.condition(), evaluator, sid, nodeId, out).ifPresent(e -> collect(e, used, firstUse, nodeId));
                if (!scenario.hasBranch(nodeId, BranchType.TRUE_BRANCH)) {
                    out.add(Diagnostic.warning("W001", sid, nodeId, "If node has no True branch"));
                }
                if (!scenario.hasBranch(nodeId, BranchType.FALSE_BRANCH)) {
                    out.add(Diagnostic.warning("W002", sid, nodeId, "If node has no False branch"));
                }
            } else if (activity instanceof Activity.While a) {
                parse(a.condition(), evaluator, sid, nodeId, out).ifPresent(e -> collect(e, used, firstUse, nodeId));
                if (!scenario.hasBranch(nodeId, BranchType.LOOP_BODY)) {
                    out.add(Diagnostic.warning("W007", sid, nodeId, "While node has no body; loop will be skipped"));
                }
            } else if (activity instanceof Activity.Loop a) {
                validateLoop(scenario, nodeId, a, out);
                defined.add(a.index());
            } else if (activity instanceof Activity.TryCatch) {
                if (!scenario.hasBranch(nodeId, BranchType.TRY_BRANCH)) {
                    out.add(Diagnostic.warning("W003", sid, nodeId, "Try-Catch node has no Try branch"));
                }
                if (!scenario.hasBranch(nodeId, BranchType.CATCH_BRANCH)) {
                    out.add(Diagnostic.warning("W004", sid, nodeId,
                            "Try-Catch node has no Catch branch; errors in Try will not be caught"));
                }
            } else if (activity instanceof Activity.SetVariable a) {
                if (a.name().isBlank()) {
                    out.add(Diagnostic.error("E201", sid, nodeId, "Set Variable node has an empty variable name"));
                }
                try {
                    a.varType().parse(a.value());
                } catch (IllegalArgumentException e) {
                    out.add(Diagnostic.error("E105", sid, nodeId, "Invalid " + a.varType() + " value: " + e.getMessage()));
                }
                defined.add(a.name());
            } else if (activity instanceof Activity.Evaluate a) {
                parse(a.expression(), evaluator, sid, nodeId, out).ifPresent(e -> collect(e, used, firstUse, nodeId));
                if (a.resultVariable() != null && !a.resultVariable().isBlank()) {
                    defined.add(a.resultVariable());
                }
            } else if (activity instanceof Activity.Log a) {
                collect(evaluator.parseTemplate(a.message()), used, firstUse, nodeId);
            } else if (activity instanceof Activity.Delay a) {
                if (a.milliseconds() < 0) {
                    out.add(Diagnostic.error("E106", sid, nodeId, "Delay must not be negative: " + a.milliseconds()));
                }
            } else if (activity instanceof Activity.CallScenario a) {
                validateCall(project, scenario, nodeId, a, out);
                for (VariableBinding b : a.parameters()) {
                    if (b.direction().copiesIn()) {
                        used.add(b.sourceVarName());
                        firstUse.putIfAbsent(b.sourceVarName(), nodeId);
                    }
                    if (b.direction().copiesOut()) {
                        defined.add(b.sourceVarName());
                    }
                }
            }
        }

        for (String name : used) {
            if (!defined.contains(name)) {
                out.add(Diagnostic.warning("W005", sid, firstUse.get(name),
                        "Variable '" + name + "' is used but never defined in this scenario"));
            }
        }
        checkDeadEnds(scenario, reachable, out);
    }

    private static void validateLoop(Scenario scenario, String nodeId, Activity.Loop loop, List<Diagnostic> out) {
        String sid = scenario.id();
        if (loop.index().isBlank()) {
            out.add(Diagnostic.error("E201", sid, nodeId, "Loop node has an empty index variable"));
        }
        if (loop.step() == 0) {
            out.add(Diagnostic.error("E101", sid, nodeId, "Loop node has step = 0, which would cause infinite loop"));
        } else if (loop.step() > 0 && loop.start() >= loop.end()) {
            out.add(Diagnostic.error("E102", sid, nodeId, "Loop node has invalid parameters: start (" + loop.start()
                    + ") >= end (" + loop.end() + ") with positive step (" + loop.step() + ")"));
        } else if (loop.step() < 0 && loop.start() <= loop.end()) {
            out.add(Diagnostic.error("E102", sid, nodeId, "Loop node has invalid parameters: start (" + loop.start()
                    + ") <= end (" + loop.end() + ") with negative step (" + loop.step() + ")"));
        }
        if (!scenario.hasBranch(nodeId, BranchType.LOOP_BODY)) {
            out.add(Diagnostic.warning("W007", sid, nodeId, "Loop node has no body; loop will be skipped"));
        }
    }

    private static void validateCall(Project project, Scenario scenario, String nodeId, Activity.CallScenario call,
                                     List<Diagnostic> out) {
        String sid = scenario.id();
        Optional<Scenario> callee = project.scenario(call.scenarioId());
        if (callee.isEmpty()) {
            out.add(Diagnostic.error("E103", sid, nodeId,
                    "Call Scenario references non-existent scenario '" + call.scenarioId() + "'"));
            return;
        }
        for (VariableBinding b : call.parameters()) {
            if (b.targetVarName().isBlank() || b.sourceVarName().isBlank()) {
                out.add(Diagnostic.error("E201", sid, nodeId, "Call Scenario binding has an empty variable name"));
            } else if (callee.get().parameter(b.targetVarName()).isEmpty()) {
                out.add(Diagnostic.warning("W008", sid, nodeId, "Scenario '" + call.scenarioId()
                        + "' does not declare parameter '" + b.targetVarName() + "'"));
            }
        }
    }

    /**
     * Flags reachable nodes from which no End can be reached. Loop bodies end by iterating, so
     * their nodes are exempt, as are Continue and Break.
     */
    private static void checkDeadEnds(Scenario scenario, Set<String> reachable, List<Diagnostic> out) {
        Set<String> canReachEnd = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        for (Node end : scenario.endNodes()) {
            canReachEnd.add(end.id());
            queue.add(end.id());
        }
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (Connection c : scenario.connections()) {
                if (c.toNode().equals(current) && canReachEnd.add(c.fromNode())) {
                    queue.add(c.fromNode());
                }
            }
        }
        Set<String> loopBodies = loopBodyNodes(scenario);
        for (String nodeId : reachable) {
            Activity activity = scenario.node(nodeId).map(Node::activity).orElse(null);
            if (canReachEnd.contains(nodeId) || loopBodies.contains(nodeId)
                    || activity instanceof Activity.Continue || activity instanceof Activity.Break
                    || activity instanceof Activity.Note) {
                continue;
            }
            out.add(Diagnostic.warning("W009", scenario.id(), nodeId,
                    "Node is reachable from Start but doesn't lead to End; the path stops here"));
        }
    }

    private static Set<String> loopBodyNodes(Scenario scenario) {
        Set<String> body = new HashSet<>();
        for (Node node : scenario.nodes()) {
            if (!(node.activity() instanceof Activity.Loop) && !(node.activity() instanceof Activity.While)) {
                continue;
            }
            Deque<String> queue = new ArrayDeque<>();
            scenario.target(node.id(), BranchType.LOOP_BODY).ifPresent(queue::add);
            while (!queue.isEmpty()) {
                String current = queue.poll();
                if (current.equals(node.id()) || !body.add(current)) {
                    continue;
                }
                scenario.outgoing(current).forEach(c -> queue.add(c.toNode()));
            }
        }
        return body;
    }

    private static Optional<Expression> parse(String text, ExpressionEvaluator evaluator, String scenarioId,
                                              String nodeId, List<Diagnostic> out) {
        try {
            return Optional.of(evaluator.parse(text));
        } catch (ExpressionParseException e) {
            out.add(Diagnostic.error("E104", scenarioId, nodeId, "Invalid expression syntax: " + e.getMessage()));
            return Optional.empty();
        }
    }

    private static void collect(Expression expression, Set<String> used, Map<String, String> firstUse, String nodeId) {
        if (expression instanceof Expression.Variable v) {
            used.add(v.name());
            firstUse.putIfAbsent(v.name(), nodeId);
        } else if (expression instanceof Expression.Unary u) {
            collect(u.operand(), used, firstUse, nodeId);
        } else if (expression instanceof Expression.Binary b) {
            collect(b.left(), used, firstUse, nodeId);
            collect(b.right(), used, firstUse, nodeId);
        } else if (expression instanceof Expression.Template t) {
            t.parts().forEach(p -> collect(p, used, firstUse, nodeId));
        }
    }
}
