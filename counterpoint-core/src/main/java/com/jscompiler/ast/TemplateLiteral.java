package com.jscompiler.ast;

import java.util.List;

/**
 * A string interpolation. Text segments are string {@link Literal}s, interpolated
 * segments are arbitrary expressions, in source order.
 */
public record TemplateLiteral(
    int start,
    int end,
    List<Expression> parts
) implements Expression {
    public TemplateLiteral(List<Expression> parts) {
        this(0, 0, parts);
    }

    @Override
    public String type() {
        return "TemplateLiteral";
    }
}
