package com.jscompiler.ast;

public sealed interface Statement extends Node permits
    BlockStatement,
    ExpressionStatement,
    VariableDeclaration,
    ReturnStatement,
    ThrowStatement,
    IfStatement,
    TryStatement,
    CatchClause,
    WhileStatement,
    DoWhileStatement,
    ForOfStatement,
    ForInStatement,
    BreakStatement,
    ContinueStatement,
    EmptyStatement {

    @Override
    default NodeKind nodeKind() {
        return NodeKind.STATEMENT;
    }
}
