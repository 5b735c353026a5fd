package com.jscompiler.ast;

public record DoWhileStatement(
    int start,
    int end,
    Statement body,
    Expression test
) implements Statement {
    public DoWhileStatement(Statement body, Expression test) {
        this(0, 0, body, test);
    }

    @Override
    public String type() {
        return "DoWhileStatement";
    }
}
