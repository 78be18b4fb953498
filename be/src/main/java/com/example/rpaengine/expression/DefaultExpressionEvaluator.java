package com.example.rpaengine.expression;

import com.example.rpaengine.variables.Value;
import com.example.rpaengine.variables.VariableStore;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent expression language: {@code {var}} references, numbers, "strings",
 * true/false, arithmetic ({@code + - * / %}), comparisons and boolean logic
 * ({@code && || !} or {@code AND OR NOT}).
 * <p>
 * Ordering comparisons with an undefined operand are false, so an unset variable never
 * satisfies {@code {x} > 0}. {@code +} concatenates as soon as one side is a string.
 * </p>
 */
public class DefaultExpressionEvaluator implements ExpressionEvaluator {

    @Override
    public Expression parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ExpressionParseException("empty expression", text != null ? text : "", 0);
        }
        return new Parser(text).parseAll();
    }

    @Override
    public Expression parseTemplate(String text) {
        String source = text != null ? text : "";
        if (source.isBlank()) {
            return template(source);
        }
        try {
            return parse(source);
        } catch (ExpressionParseException e) {
            return template(source);
        }
    }

    @Override
    public Value evaluate(Expression expression, VariableStore variables) {
        if (expression instanceof Expression.Literal literal) {
            return literal.value();
        }
        if (expression instanceof Expression.Variable variable) {
            return variables.get(variable.name());
        }
        if (expression instanceof Expression.Unary unary) {
            return unary(unary.op(), evaluate(unary.operand(), variables));
        }
        if (expression instanceof Expression.Binary binary) {
            return binary(binary, variables);
        }
        if (expression instanceof Expression.Template template) {
            StringBuilder sb = new StringBuilder();
            for (Expression part : template.parts()) {
                sb.append(evaluate(part, variables).display());
            }
            return Value.of(sb.toString());
        }
        throw new EvaluationException("unsupported expression: " + expression);
    }

    private static Expression template(String text) {
        List<Expression> parts = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '{') {
                int close = text.indexOf('}', i + 1);
                if (close > i + 1 && isIdentifier(text.substring(i + 1, close))) {
                    if (literal.length() > 0) {
                        parts.add(new Expression.Literal(Value.of(literal.toString())));
                        literal.setLength(0);
                    }
                    parts.add(new Expression.Variable(text.substring(i + 1, close)));
                    i = close + 1;
                    continue;
                }
            }
            literal.append(c);
            i++;
        }
        if (literal.length() > 0 || parts.isEmpty()) {
            parts.add(new Expression.Literal(Value.of(literal.toString())));
        }
        return new Expression.Template(parts);
    }

    private static boolean isIdentifier(String s) {
        if (s.isEmpty() || !(Character.isLetter(s.charAt(0)) || s.charAt(0) == '_')) {
            return false;
        }
        for (int i = 1; i < s.length(); i++) {
            char c = s.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '_') {
                return false;
            }
        }
        return true;
    }

    private Value binary(Expression.Binary binary, VariableStore variables) {
        Operator op = binary.op();
        if (op == Operator.AND) {
            return Value.of(condition(evaluate(binary.left(), variables), op)
                    && condition(evaluate(binary.right(), variables), op));
        }
        if (op == Operator.OR) {
            return Value.of(condition(evaluate(binary.left(), variables), op)
                    || condition(evaluate(binary.right(), variables), op));
        }
        Value left = evaluate(binary.left(), variables);
        Value right = evaluate(binary.right(), variables);
        switch (op) {
            case ADD:
                if (left instanceof Value.Str || right instanceof Value.Str) {
                    return Value.of(left.display() + right.display());
                }
                return Value.of(number(left, op) + number(right, op));
            case SUB:
                return Value.of(number(left, op) - number(right, op));
            case MUL:
                return Value.of(number(left, op) * number(right, op));
            case DIV: {
                double d = number(right, op);
                if (d == 0) {
                    throw new EvaluationException("division by zero");
                }
                return Value.of(number(left, op) / d);
            }
            case MOD: {
                double d = number(right, op);
                if (d == 0) {
                    throw new EvaluationException("modulo by zero");
                }
                return Value.of(number(left, op) % d);
            }
            case EQ:
                return Value.of(equal(left, right));
            case NE:
                return Value.of(!equal(left, right));
            case LT:
            case LE:
            case GT:
            case GE:
                return Value.of(compare(op, left, right));
            default:
                throw new EvaluationException("unsupported binary operator " + op.symbol());
        }
    }

    private static Value unary(Operator op, Value operand) {
        if (op == Operator.NOT) {
            return Value.of(!condition(operand, op));
        }
        if (op == Operator.NEG) {
            return Value.of(-number(operand, op));
        }
        throw new EvaluationException("unsupported unary operator " + op.symbol());
    }

    private static boolean equal(Value left, Value right) {
        if (left instanceof Value.Num a && right instanceof Value.Num b) {
            return a.value() == b.value();
        }
        return left.equals(right);
    }

    private static boolean compare(Operator op, Value left, Value right) {
        if (left instanceof Value.Undefined || right instanceof Value.Undefined) {
            return false;
        }
        int cmp;
        if (left instanceof Value.Num a && right instanceof Value.Num b) {
            cmp = Double.compare(a.value(), b.value());
        } else if (left instanceof Value.Str a && right instanceof Value.Str b) {
            cmp = a.value().compareTo(b.value());
        } else {
            throw new EvaluationException("cannot compare " + typeName(left) + " with " + typeName(right));
        }
        return switch (op) {
            case LT -> cmp < 0;
            case LE -> cmp <= 0;
            case GT -> cmp > 0;
            case GE -> cmp >= 0;
            default -> throw new EvaluationException("not a comparison: " + op.symbol());
        };
    }

    private static double number(Value value, Operator op) {
        if (value instanceof Value.Num n) {
            return n.value();
        }
        throw new EvaluationException("operator '" + op.symbol() + "' expects a number but got " + typeName(value));
    }

    private static boolean condition(Value value, Operator op) {
        if (value instanceof Value.Bool b) {
            return b.value();
        }
        if (value instanceof Value.Undefined) {
            return false;
        }
        throw new EvaluationException("operator '" + op.symbol() + "' expects a boolean but got " + typeName(value));
    }

    static String typeName(Value value) {
        if (value instanceof Value.Str) {
            return "string";
        }
        if (value instanceof Value.Bool) {
            return "boolean";
        }
        if (value instanceof Value.Num) {
            return "number";
        }
        return "undefined";
    }

    private static final class Parser {

        private final String src;
        private int i;

        Parser(String src) {
            this.src = src;
        }

        Expression parseAll() {
            Expression e = parseOr();
            skipSpaces();
            if (i < src.length()) {
                throw error("unexpected '" + src.charAt(i) + "'");
            }
            return e;
        }

        private Expression parseOr() {
            Expression x = parseAnd();
            for (; ; ) {
                if (match("||") || matchKeyword("OR")) {
                    x = new Expression.Binary(Operator.OR, x, parseAnd());
                } else {
                    return x;
                }
            }
        }

        private Expression parseAnd() {
            Expression x = parseComparison();
            for (; ; ) {
                if (match("&&") || matchKeyword("AND")) {
                    x = new Expression.Binary(Operator.AND, x, parseComparison());
                } else {
                    return x;
                }
            }
        }

        private Expression parseComparison() {
            Expression x = parseAdditive();
            for (; ; ) {
                Operator op;
                if (match("==")) {
                    op = Operator.EQ;
                } else if (match("!=")) {
                    op = Operator.NE;
                } else if (match("<=")) {
                    op = Operator.LE;
                } else if (match(">=")) {
                    op = Operator.GE;
                } else if (match("<")) {
                    op = Operator.LT;
                } else if (match(">")) {
                    op = Operator.GT;
                } else {
                    return x;
                }
                x = new Expression.Binary(op, x, parseAdditive());
            }
        }

        private Expression parseAdditive() {
            Expression x = parseTerm();
            for (; ; ) {
                if (match("+")) {
                    x = new Expression.Binary(Operator.ADD, x, parseTerm());
                } else if (match("-")) {
                    x = new Expression.Binary(Operator.SUB, x, parseTerm());
                } else {
                    return x;
                }
            }
        }

        private Expression parseTerm() {
            Expression x = parseUnary();
            for (; ; ) {
                if (match("*")) {
                    x = new Expression.Binary(Operator.MUL, x, parseUnary());
                } else if (match("/")) {
                    x = new Expression.Binary(Operator.DIV, x, parseUnary());
                } else if (match("%")) {
                    x = new Expression.Binary(Operator.MOD, x, parseUnary());
                } else {
                    return x;
                }
            }
        }

        private Expression parseUnary() {
            if (match("-")) {
                return new Expression.Unary(Operator.NEG, parseUnary());
            }
            if (peek() == '!' && peekAt(1) != '=') {
                i++;
                return new Expression.Unary(Operator.NOT, parseUnary());
            }
            if (matchKeyword("NOT")) {
                return new Expression.Unary(Operator.NOT, parseUnary());
            }
            return parsePrimary();
        }

        private Expression parsePrimary() {
            skipSpaces();
            if (i >= src.length()) {
                throw error("unexpected end of expression");
            }
            char c = src.charAt(i);
            if (c == '(') {
                i++;
                Expression x = parseOr();
                if (!match(")")) {
                    throw error("missing ')'");
                }
                return x;
            }
            if (c == '{') {
                int close = src.indexOf('}', i + 1);
                if (close < 0) {
                    throw error("unterminated variable reference");
                }
                String name = src.substring(i + 1, close).trim();
                if (!isIdentifier(name)) {
                    throw error("invalid variable name '" + name + "'");
                }
                i = close + 1;
                return new Expression.Variable(name);
            }
            if (c == '"') {
                int close = src.indexOf('"', i + 1);
                if (close < 0) {
                    throw error("unterminated string");
                }
                String s = src.substring(i + 1, close);
                i = close + 1;
                return new Expression.Literal(Value.of(s));
            }
            if (Character.isDigit(c) || c == '.') {
                int start = i;
                while (i < src.length() && (Character.isDigit(src.charAt(i)) || src.charAt(i) == '.')) {
                    i++;
                }
                String num = src.substring(start, i);
                try {
                    return new Expression.Literal(Value.of(Double.parseDouble(num)));
                } catch (NumberFormatException e) {
                    i = start;
                    throw error("invalid number '" + num + "'");
                }
            }
            if (Character.isLetter(c)) {
                int start = i;
                while (i < src.length() && (Character.isLetterOrDigit(src.charAt(i)) || src.charAt(i) == '_')) {
                    i++;
                }
                String word = src.substring(start, i);
                if ("true".equals(word)) {
                    return new Expression.Literal(Value.of(true));
                }
                if ("false".equals(word)) {
                    return new Expression.Literal(Value.of(false));
                }
                i = start;
                throw error("unknown identifier '" + word + "'; use {" + word + "} for variables");
            }
            throw error("unexpected '" + c + "'");
        }

        private boolean match(String token) {
            skipSpaces();
            if (src.startsWith(token, i)) {
                i += token.length();
                return true;
            }
            return false;
        }

        private boolean matchKeyword(String keyword) {
            skipSpaces();
            int end = i + keyword.length();
            if (src.regionMatches(true, i, keyword, 0, keyword.length())
                    && (end >= src.length() || !Character.isLetterOrDigit(src.charAt(end)))) {
                i = end;
                return true;
            }
            return false;
        }

        private char peek() {
            skipSpaces();
            return i < src.length() ? src.charAt(i) : '\0';
        }

        private char peekAt(int offset) {
            int j = i + offset;
            return j < src.length() ? src.charAt(j) : '\0';
        }

        private void skipSpaces() {
            while (i < src.length() && Character.isWhitespace(src.charAt(i))) {
                i++;
            }
        }

        private ExpressionParseException error(String message) {
            return new ExpressionParseException(message, src, i);
        }
    }
}
