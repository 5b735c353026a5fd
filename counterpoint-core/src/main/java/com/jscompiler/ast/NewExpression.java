package com.jscompiler.ast;

import java.util.List;

public record NewExpression(
    int start,
    int end,
    Expression callee,
    List<Expression> arguments
) implements Expression {
    public NewExpression(Expression callee, List<Expression> arguments) {
        this(0, 0, callee, arguments);
    }

    @Override
    public String type() {
        return "NewExpression";
    }
}
