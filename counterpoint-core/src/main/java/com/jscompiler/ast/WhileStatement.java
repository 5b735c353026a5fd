package com.jscompiler.ast;

public record WhileStatement(
    int start,
    int end,
    Expression test,
    Statement body
) implements Statement {
    public WhileStatement(Expression test, Statement body) {
        this(0, 0, test, body);
    }

    @Override
    public String type() {
        return "WhileStatement";
    }
}
