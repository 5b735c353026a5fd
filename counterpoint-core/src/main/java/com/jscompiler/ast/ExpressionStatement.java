package com.jscompiler.ast;

public record ExpressionStatement(
    int start,
    int end,
    Expression expression
) implements Statement {
    public ExpressionStatement(Expression expression) {
        this(0, 0, expression);
    }

    @Override
    public String type() {
        return "ExpressionStatement";
    }
}
