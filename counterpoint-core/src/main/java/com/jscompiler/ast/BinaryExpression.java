package com.jscompiler.ast;

public record BinaryExpression(
    int start,
    int end,
    String operator,
    Expression left,
    Expression right
) implements Expression {
    public BinaryExpression(Expression left, String operator, Expression right) {
        this(0, 0, operator, left, right);
    }

    @Override
    public String type() {
        return "BinaryExpression";
    }
}
