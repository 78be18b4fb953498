package com.example.rpaengine.expression;

import com.example.rpaengine.variables.Value;
import com.example.rpaengine.variables.VariableStore;

/**
 * Parses expression text at compile time and evaluates the result at run time.
 */
public interface ExpressionEvaluator {

    /**
     * @throws ExpressionParseException if the text is not a valid expression
     */
    Expression parse(String text);

    /**
     * Parses a log message: a valid expression is used as is, anything else is treated as
     * literal text with {@code {name}} placeholders.
     */
    Expression parseTemplate(String text);

    /**
     * @throws EvaluationException on type errors or division by zero
     */
    Value evaluate(Expression expression, VariableStore variables);
}
