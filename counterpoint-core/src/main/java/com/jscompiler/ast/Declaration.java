package com.jscompiler.ast;

public sealed interface Declaration extends Node permits FunctionDeclaration, Parameter {

    @Override
    default NodeKind nodeKind() {
        return NodeKind.DECLARATION;
    }
}
