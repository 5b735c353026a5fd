package com.jscompiler.ast;

import java.util.List;

public record FunctionDeclaration(
    int start,
    int end,
    String name,  // Can be null for anonymous closures handed to the compiler
    List<Parameter> params,
    BlockStatement body
) implements Declaration {
    public FunctionDeclaration(List<Parameter> params, BlockStatement body) {
        this(0, 0, null, params, body);
    }

    @Override
    public String type() {
        return "FunctionDeclaration";
    }
}
