package com.jscompiler.ast;

/**
 * Property access ({@code a.b}) when not computed, element access ({@code a[b]})
 * when computed. For property access the property is an {@link Identifier}.
 */
public record MemberExpression(
    int start,
    int end,
    Expression object,
    Expression property,
    boolean computed
) implements Expression {
    public MemberExpression(Expression object, Expression property, boolean computed) {
        this(0, 0, object, property, computed);
    }

    public static MemberExpression property(Expression object, String name) {
        return new MemberExpression(object, new Identifier(name), false);
    }

    public static MemberExpression element(Expression object, Expression element) {
        return new MemberExpression(object, element, true);
    }

    /**
     * @return the property name for a non-computed access, otherwise null
     */
    public String propertyName() {
        return !computed && property instanceof Identifier id ? id.name() : null;
    }

    @Override
    public String type() {
        return "MemberExpression";
    }
}
