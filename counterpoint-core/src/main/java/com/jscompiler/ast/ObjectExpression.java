package com.jscompiler.ast;

import java.util.List;

public record ObjectExpression(
    int start,
    int end,
    List<Expression> properties  // Can be Property or SpreadElement
) implements Expression {
    public ObjectExpression(List<Expression> properties) {
        this(0, 0, properties);
    }

    /**
     * Finds a non-computed property by its static key. A later property with the
     * same key overrides an earlier one.
     *
     * @return the property, or null if absent
     */
    public Property getProperty(String name) {
        for (int i = properties.size() - 1; i >= 0; i--) {
            if (properties.get(i) instanceof Property p && name.equals(p.staticKey())) {
                return p;
            }
        }
        return null;
    }

    @Override
    public String type() {
        return "ObjectExpression";
    }
}
