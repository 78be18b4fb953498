package com.example.rpaengine.ir;

/**
 * Error-interception entry: a failure at an address in {@code [start, end)} transfers control to
 * {@code catchTarget}.
 */
public record TryRange(int start, int end, int catchTarget, String scenarioId, String nodeId) {

    public boolean contains(int address) {
        return address >= start && address < end;
    }

    public int length() {
        return end - start;
    }
}
