package com.jscompiler.ast;

public sealed interface Expression extends Node permits
    Identifier,
    Literal,
    ReferenceExpression,
    MemberExpression,
    CallExpression,
    NewExpression,
    UnaryExpression,
    BinaryExpression,
    LogicalExpression,
    ConditionalExpression,
    AssignmentExpression,
    ArrayExpression,
    ObjectExpression,
    Property,
    SpreadElement,
    TemplateLiteral,
    ArrowFunctionExpression {

    @Override
    default NodeKind nodeKind() {
        return NodeKind.EXPRESSION;
    }
}
