package com.jscompiler.ast;

import java.util.List;

public record CallExpression(
    int start,
    int end,
    Expression callee,
    List<Expression> arguments
) implements Expression {
    public CallExpression(Expression callee, List<Expression> arguments) {
        this(0, 0, callee, arguments);
    }

    /**
     * @return the argument at {@code index}, or null when absent
     */
    public Expression argument(int index) {
        return index < arguments.size() ? arguments.get(index) : null;
    }

    @Override
    public String type() {
        return "CallExpression";
    }
}
