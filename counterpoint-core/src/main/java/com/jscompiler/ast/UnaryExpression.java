package com.jscompiler.ast;

public record UnaryExpression(
    int start,
    int end,
    String operator,  // "-" | "+" | "!" | "typeof"
    Expression argument
) implements Expression {
    public UnaryExpression(String operator, Expression argument) {
        this(0, 0, operator, argument);
    }

    @Override
    public String type() {
        return "UnaryExpression";
    }
}
