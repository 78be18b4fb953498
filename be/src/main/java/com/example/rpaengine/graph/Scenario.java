package com.example.rpaengine.graph;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * One workflow graph: nodes, connections between them, and the declared parameters.
 * <p>
 * Read-only view for the compiler. Adjacency queries resolve duplicates deterministically:
 * for a given (node, branch) the first connection in declaration order wins.
 * </p>
 */
public record Scenario(
        String id,
        String name,
        List<Node> nodes,
        List<Connection> connections,
        List<ScenarioParameter> parameters
) {
    public Scenario {
        Objects.requireNonNull(id, "id");
        name = name != null ? name : id;
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        connections = connections != null ? List.copyOf(connections) : List.of();
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
    }

    public Optional<Node> node(String nodeId) {
        for (Node n : nodes) {
            if (n.id().equals(nodeId)) {
                return Optional.of(n);
            }
        }
        return Optional.empty();
    }

    public Optional<Node> startNode() {
        return nodes.stream().filter(n -> n.activity() instanceof Activity.Start).findFirst();
    }

    public List<Node> endNodes() {
        return nodes.stream().filter(n -> n.activity() instanceof Activity.End).toList();
    }

    public List<Connection> outgoing(String nodeId) {
        return connections.stream().filter(c -> c.fromNode().equals(nodeId)).toList();
    }

    /**
     * Target node id of the first outgoing connection of the given branch type.
     */
    public Optional<String> target(String nodeId, BranchType branch) {
        for (Connection c : connections) {
            if (c.fromNode().equals(nodeId) && c.branchType() == branch) {
                return Optional.of(c.toNode());
            }
        }
        return Optional.empty();
    }

    public boolean hasBranch(String nodeId, BranchType branch) {
        return target(nodeId, branch).isPresent();
    }

    /**
     * Ids of all nodes reachable from the Start node over connections of any branch type,
     * in breadth-first order. Empty when the scenario has no Start node.
     */
    public Set<String> reachableFromStart() {
        Set<String> reachable = new LinkedHashSet<>();
        Optional<Node> start = startNode();
        if (start.isEmpty()) {
            return reachable;
        }
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start.get().id());
        reachable.add(start.get().id());
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (Connection c : connections) {
                if (c.fromNode().equals(current) && node(c.toNode()).isPresent() && reachable.add(c.toNode())) {
                    queue.add(c.toNode());
                }
            }
        }
        return reachable;
    }

    public Optional<ScenarioParameter> parameter(String varName) {
        return parameters.stream().filter(p -> p.varName().equals(varName)).findFirst();
    }
}
