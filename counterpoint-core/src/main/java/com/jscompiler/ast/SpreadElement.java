package com.jscompiler.ast;

public record SpreadElement(
    int start,
    int end,
    Expression argument
) implements Expression {
    public SpreadElement(Expression argument) {
        this(0, 0, argument);
    }

    @Override
    public String type() {
        return "SpreadElement";
    }
}
