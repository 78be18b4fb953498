package com.example.rpaengine.expression;

import lombok.Getter;

/**
 * Thrown when expression text cannot be parsed.
 */
@Getter
public class ExpressionParseException extends RuntimeException {

    private final String source;
    private final int position;

    public ExpressionParseException(String message, String source, int position) {
        super(message + " at position " + position + " in '" + source + "'");
        this.source = source;
        this.position = position;
    }
}
