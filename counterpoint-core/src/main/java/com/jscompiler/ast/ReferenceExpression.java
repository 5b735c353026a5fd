package com.jscompiler.ast;

/**
 * A reference to a value that only exists once infrastructure is wired, such as a
 * table, a function or a state machine. The compiler resolves it through the
 * {@code ExternalReferences} collaborator.
 */
public record ReferenceExpression(
    int start,
    int end,
    String name
) implements Expression {
    public ReferenceExpression(String name) {
        this(0, 0, name);
    }

    @Override
    public String type() {
        return "ReferenceExpression";
    }
}
