package com.example.rpaengine.variables;

/**
 * Declared type of a SetVariable literal; converts the authored text into a {@link Value}.
 */
public enum VariableType {
    STRING,
    BOOLEAN,
    NUMBER;

    /**
     * @throws IllegalArgumentException if the text is not a valid literal of this type
     */
    public Value parse(String text) {
        String raw = text != null ? text : "";
        return switch (this) {
            case STRING -> Value.of(raw);
            case BOOLEAN -> {
                String t = raw.trim();
                if ("true".equalsIgnoreCase(t)) {
                    yield Value.of(true);
                }
                if ("false".equalsIgnoreCase(t)) {
                    yield Value.of(false);
                }
                throw new IllegalArgumentException("not a boolean: '" + raw + "'");
            }
            case NUMBER -> {
                try {
                    yield Value.of(Double.parseDouble(raw.trim()));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("not a number: '" + raw + "'", e);
                }
            }
        };
    }
}
