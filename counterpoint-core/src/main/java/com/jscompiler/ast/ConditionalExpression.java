package com.jscompiler.ast;

public record ConditionalExpression(
    int start,
    int end,
    Expression test,
    Expression consequent,
    Expression alternate
) implements Expression {
    public ConditionalExpression(Expression test, Expression consequent, Expression alternate) {
        this(0, 0, test, consequent, alternate);
    }

    @Override
    public String type() {
        return "ConditionalExpression";
    }
}
