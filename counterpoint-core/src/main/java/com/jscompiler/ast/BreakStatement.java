package com.jscompiler.ast;

public record BreakStatement(
    int start,
    int end
) implements Statement {
    public BreakStatement() {
        this(0, 0);
    }

    @Override
    public String type() {
        return "BreakStatement";
    }
}
