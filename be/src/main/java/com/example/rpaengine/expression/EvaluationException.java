package com.example.rpaengine.expression;

/**
 * Thrown when a parsed expression cannot be evaluated against the current variables
 * (type mismatch, division by zero).
 */
public class EvaluationException extends RuntimeException {

    public EvaluationException(String message) {
        super(message);
    }
}
