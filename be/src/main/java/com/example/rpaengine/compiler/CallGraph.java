package com.example.rpaengine.compiler;

import com.example.rpaengine.graph.Activity;
import com.example.rpaengine.graph.Node;
import com.example.rpaengine.graph.Project;
import com.example.rpaengine.graph.Scenario;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed graph of scenario invocations, built from reachable CallScenario nodes.
 * <p>
 * Recursion is allowed at run time (bounded by the call-stack limit); this graph only reports it.
 * </p>
 */
public final class CallGraph {

    private final Map<String, Set<String>> edges;
    private final List<List<String>> cycles;

    private CallGraph(Map<String, Set<String>> edges) {
        this.edges = edges;
        this.cycles = findCycles(edges);
    }

    public static CallGraph of(Project project) {
        Map<String, Set<String>> edges = new LinkedHashMap<>();
        for (Scenario scenario : project.scenarios()) {
            Set<String> callees = new LinkedHashSet<>();
            for (String nodeId : scenario.reachableFromStart()) {
                scenario.node(nodeId)
                        .map(Node::activity)
                        .filter(Activity.CallScenario.class::isInstance)
                        .map(a -> ((Activity.CallScenario) a).scenarioId())
                        .ifPresent(callees::add);
            }
            edges.putIfAbsent(scenario.id(), callees);
        }
        return new CallGraph(edges);
    }

    public Set<String> callees(String scenarioId) {
        return Collections.unmodifiableSet(edges.getOrDefault(scenarioId, Set.of()));
    }

    /**
     * Distinct call cycles, each as the chain of scenario ids closing back on its first element.
     */
    public List<List<String>> cycles() {
        return cycles;
    }

    public boolean isRecursive(String scenarioId) {
        return cycles.stream().anyMatch(c -> c.contains(scenarioId));
    }

    private static List<List<String>> findCycles(Map<String, Set<String>> edges) {
        List<List<String>> found = new ArrayList<>();
        Set<Set<String>> seen = new HashSet<>();
        for (String root : edges.keySet()) {
            dfs(root, new ArrayList<>(), edges, found, seen);
        }
        return Collections.unmodifiableList(found);
    }

    private static void dfs(String current, List<String> path, Map<String, Set<String>> edges,
                            List<List<String>> found, Set<Set<String>> seen) {
        int onPath = path.indexOf(current);
        if (onPath >= 0) {
            List<String> chain = new ArrayList<>(path.subList(onPath, path.size()));
            if (seen.add(new HashSet<>(chain))) {
                chain.add(current);
                found.add(List.copyOf(chain));
            }
            return;
        }
        path.add(current);
        for (String callee : edges.getOrDefault(current, Set.of())) {
            if (edges.containsKey(callee)) {
                dfs(callee, path, edges, found, seen);
            }
        }
        path.remove(path.size() - 1);
    }
}
