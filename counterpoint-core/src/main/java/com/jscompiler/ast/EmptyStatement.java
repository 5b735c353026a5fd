package com.jscompiler.ast;

public record EmptyStatement(
    int start,
    int end
) implements Statement {
    public EmptyStatement() {
        this(0, 0);
    }

    @Override
    public String type() {
        return "EmptyStatement";
    }
}
