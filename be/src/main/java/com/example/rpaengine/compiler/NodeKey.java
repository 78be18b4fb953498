package com.example.rpaengine.compiler;

/**
 * Scenario-qualified node identity. Node ids are only unique within a scenario, so compiled-node
 * bookkeeping is always keyed by both parts.
 */
record NodeKey(String scenarioId, String nodeId) {
}
