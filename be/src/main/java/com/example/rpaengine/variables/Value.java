package com.example.rpaengine.variables;

import java.util.Objects;

/**
 * Runtime value held by the {@link VariableStore}: string, boolean, number or undefined.
 */
public sealed interface Value permits Value.Str, Value.Bool, Value.Num, Value.Undefined {

    Value UNDEFINED = new Undefined();

    /**
     * Text form used by log messages and string concatenation.
     */
    String display();

    /**
     * Truthiness for conditions: only {@code true} is true; undefined is false.
     */
    default boolean isTrue() {
        return this instanceof Bool b && b.value();
    }

    static Value of(String value) {
        return new Str(value);
    }

    static Value of(boolean value) {
        return new Bool(value);
    }

    static Value of(double value) {
        return new Num(value);
    }

    /**
     * Converts a plain JSON-style value (string, boolean, number, null) into a {@link Value}.
     *
     * @throws IllegalArgumentException for any other type
     */
    static Value fromObject(Object object) {
        if (object == null) {
            return UNDEFINED;
        }
        if (object instanceof String s) {
            return of(s);
        }
        if (object instanceof Boolean b) {
            return of(b);
        }
        if (object instanceof Number n) {
            return of(n.doubleValue());
        }
        throw new IllegalArgumentException("unsupported value type: " + object.getClass().getSimpleName());
    }

    /**
     * Plain Java form for JSON responses; undefined maps to null.
     */
    default Object toObject() {
        if (this instanceof Str s) {
            return s.value();
        }
        if (this instanceof Bool b) {
            return b.value();
        }
        if (this instanceof Num n) {
            return n.value();
        }
        return null;
    }

    record Str(String value) implements Value {
        public Str {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String display() {
            return value;
        }
    }

    record Bool(boolean value) implements Value {
        @Override
        public String display() {
            return Boolean.toString(value);
        }
    }

    record Num(double value) implements Value {
        @Override
        public String display() {
            if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
                return Long.toString((long) value);
            }
            return Double.toString(value);
        }
    }

    record Undefined() implements Value {
        @Override
        public String display() {
            return "undefined";
        }
    }
}
