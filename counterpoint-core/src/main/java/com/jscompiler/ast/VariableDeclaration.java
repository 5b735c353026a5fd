package com.jscompiler.ast;

/**
 * Binds a single name. Multi-declarator statements are split upstream.
 */
public record VariableDeclaration(
    int start,
    int end,
    String kind,  // "var" | "let" | "const"
    String name,
    Expression init  // Can be null
) implements Statement {
    public VariableDeclaration(String name, Expression init) {
        this(0, 0, "const", name, init);
    }

    @Override
    public String type() {
        return "VariableDeclaration";
    }
}
