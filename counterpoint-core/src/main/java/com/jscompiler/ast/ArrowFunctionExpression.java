package com.jscompiler.ast;

import java.util.List;

/**
 * An inline anonymous function. Expression bodies are normalized upstream into a
 * block holding a single return.
 */
public record ArrowFunctionExpression(
    int start,
    int end,
    List<Parameter> params,
    BlockStatement body
) implements Expression {
    public ArrowFunctionExpression(List<Parameter> params, BlockStatement body) {
        this(0, 0, params, body);
    }

    @Override
    public String type() {
        return "ArrowFunctionExpression";
    }
}
