package com.jscompiler.ast;

public record ThrowStatement(
    int start,
    int end,
    Expression argument
) implements Statement {
    public ThrowStatement(Expression argument) {
        this(0, 0, argument);
    }

    @Override
    public String type() {
        return "ThrowStatement";
    }
}
