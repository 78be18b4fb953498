package com.example.rpaengine.graph;

import java.util.Objects;

/**
 * Directed edge between two nodes of the same scenario. A missing branch type means {@link BranchType#DEFAULT}.
 */
public record Connection(String id, String fromNode, String toNode, BranchType branchType) {
    public Connection {
        Objects.requireNonNull(fromNode, "fromNode");
        Objects.requireNonNull(toNode, "toNode");
        branchType = branchType != null ? branchType : BranchType.DEFAULT;
        id = id != null ? id : fromNode + "->" + toNode;
    }
}
