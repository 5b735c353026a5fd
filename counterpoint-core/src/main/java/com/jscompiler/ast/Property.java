package com.jscompiler.ast;

public record Property(
    int start,
    int end,
    Expression key,  // Identifier or Literal unless computed
    Expression value,
    boolean computed
) implements Expression {
    public Property(Expression key, Expression value) {
        this(0, 0, key, value, false);
    }

    public static Property of(String name, Expression value) {
        return new Property(new Identifier(name), value);
    }

    /**
     * @return the key name when it is known without evaluation, otherwise null
     */
    public String staticKey() {
        if (computed) {
            return null;
        } else if (key instanceof Identifier id) {
            return id.name();
        } else if (key instanceof Literal lit && lit.value() != null) {
            return String.valueOf(lit.value());
        }
        return null;
    }

    @Override
    public String type() {
        return "Property";
    }
}
