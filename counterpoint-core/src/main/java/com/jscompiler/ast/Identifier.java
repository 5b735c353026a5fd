package com.jscompiler.ast;

public record Identifier(
    int start,
    int end,
    String name
) implements Expression {
    public Identifier(String name) {
        this(0, 0, name);
    }

    @Override
    public String type() {
        return "Identifier";
    }
}
