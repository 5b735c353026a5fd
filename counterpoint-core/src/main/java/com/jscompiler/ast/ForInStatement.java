package com.jscompiler.ast;

public record ForInStatement(
    int start,
    int end,
    VariableDeclaration left,
    Expression right,
    Statement body
) implements Statement {
    public ForInStatement(VariableDeclaration left, Expression right, Statement body) {
        this(0, 0, left, right, body);
    }

    @Override
    public String type() {
        return "ForInStatement";
    }
}
