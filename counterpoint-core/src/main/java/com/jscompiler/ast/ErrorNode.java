package com.jscompiler.ast;

/**
 * A compile error reported by the upstream front end and carried in place of the
 * node it failed to produce.
 */
public record ErrorNode(
    int start,
    int end,
    String message
) implements Node {
    public ErrorNode(String message) {
        this(0, 0, message);
    }

    @Override
    public NodeKind nodeKind() {
        return NodeKind.ERROR;
    }

    @Override
    public String type() {
        return "Err";
    }
}
