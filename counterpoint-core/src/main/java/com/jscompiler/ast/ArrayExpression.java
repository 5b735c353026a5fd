package com.jscompiler.ast;

import java.util.List;

public record ArrayExpression(
    int start,
    int end,
    List<Expression> elements  // May contain SpreadElement
) implements Expression {
    public ArrayExpression(List<Expression> elements) {
        this(0, 0, elements);
    }

    @Override
    public String type() {
        return "ArrayExpression";
    }
}
