package com.example.rpaengine.interpreter;

/**
 * Runtime error raised by an instruction (call depth exceeded, non-boolean condition, non-numeric
 * loop index). Routed through error branches and try ranges like evaluator failures.
 */
public class ExecutionFault extends RuntimeException {

    public ExecutionFault(String message) {
        super(message);
    }
}
