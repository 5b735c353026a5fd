package com.jscompiler.ast;

public record ContinueStatement(
    int start,
    int end
) implements Statement {
    public ContinueStatement() {
        this(0, 0);
    }

    @Override
    public String type() {
        return "ContinueStatement";
    }
}
