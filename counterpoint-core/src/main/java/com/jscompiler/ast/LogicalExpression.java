package com.jscompiler.ast;

public record LogicalExpression(
    int start,
    int end,
    String operator,  // "&&" | "||" | "??"
    Expression left,
    Expression right
) implements Expression {
    public LogicalExpression(Expression left, String operator, Expression right) {
        this(0, 0, operator, left, right);
    }

    @Override
    public String type() {
        return "LogicalExpression";
    }
}
