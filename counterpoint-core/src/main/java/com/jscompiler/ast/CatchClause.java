package com.jscompiler.ast;

public record CatchClause(
    int start,
    int end,
    VariableDeclaration param,  // The caught error binding, can be null
    BlockStatement body
) implements Statement {
    public CatchClause(VariableDeclaration param, BlockStatement body) {
        this(0, 0, param, body);
    }

    @Override
    public String type() {
        return "CatchClause";
    }
}
