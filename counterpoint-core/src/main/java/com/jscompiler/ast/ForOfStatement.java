package com.jscompiler.ast;

public record ForOfStatement(
    int start,
    int end,
    VariableDeclaration left,
    Expression right,
    Statement body
) implements Statement {
    public ForOfStatement(VariableDeclaration left, Expression right, Statement body) {
        this(0, 0, left, right, body);
    }

    @Override
    public String type() {
        return "ForOfStatement";
    }
}
