package com.jscompiler.ast;

/**
 * A string, number, boolean or {@code null} literal. {@code undefined} is not a
 * literal: it is the unbound identifier {@code undefined}.
 */
public record Literal(
    int start,
    int end,
    Object value  // String, Number, Boolean or null
) implements Expression {
    public Literal(Object value) {
        this(0, 0, value);
    }

    public boolean isString() {
        return value instanceof String;
    }

    public boolean isNumber() {
        return value instanceof Number;
    }

    @Override
    public String type() {
        return "Literal";
    }
}
