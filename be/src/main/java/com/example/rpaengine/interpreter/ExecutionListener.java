package com.example.rpaengine.interpreter;

/**
 * Receives log events synchronously, in program order, on the executing thread.
 * Implementations must not block for long and must not call back into the interpreter.
 */
@FunctionalInterface
public interface ExecutionListener {

    ExecutionListener NONE = event -> {
    };

    void onLog(LogEvent event);
}
