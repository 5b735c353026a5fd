package com.jscompiler.ast;

public record ReturnStatement(
    int start,
    int end,
    Expression argument  // Can be null
) implements Statement {
    public ReturnStatement(Expression argument) {
        this(0, 0, argument);
    }

    @Override
    public String type() {
        return "ReturnStatement";
    }
}
