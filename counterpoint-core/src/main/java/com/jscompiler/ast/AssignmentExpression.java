package com.jscompiler.ast;

public record AssignmentExpression(
    int start,
    int end,
    String operator,  // only "=" is compiled
    Expression left,
    Expression right
) implements Expression {
    public AssignmentExpression(Expression left, Expression right) {
        this(0, 0, "=", left, right);
    }

    @Override
    public String type() {
        return "AssignmentExpression";
    }
}
