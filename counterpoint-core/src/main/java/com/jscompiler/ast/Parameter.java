package com.jscompiler.ast;

public record Parameter(
    int start,
    int end,
    String name
) implements Declaration {
    public Parameter(String name) {
        this(0, 0, name);
    }

    @Override
    public String type() {
        return "Parameter";
    }
}
