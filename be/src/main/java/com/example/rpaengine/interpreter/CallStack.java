package com.example.rpaengine.interpreter;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Bounded stack of active invocations. Exceeding the bound is a runtime error, never a JVM stack overflow.
 */
final class CallStack {

    private final int maxDepth;
    private final Deque<CallFrame> frames = new ArrayDeque<>();

    CallStack(int maxDepth) {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    void push(CallFrame frame) {
        if (frames.size() >= maxDepth) {
            throw new ExecutionFault("Maximum scenario call depth exceeded (" + maxDepth + ")");
        }
        frames.push(frame);
    }

    CallFrame pop() {
        return frames.pop();
    }

    CallFrame peek() {
        return frames.peek();
    }

    boolean isEmpty() {
        return frames.isEmpty();
    }

    int depth() {
        return frames.size();
    }
}
