package com.jscompiler.ast;

/**
 * Stable index of a node inside the arena of its {@link SyntaxTree}. Ids are assigned
 * in attachment order, which for {@link SyntaxTree#of(Node)} is pre-order.
 */
public record NodeId(int index) {
    @Override
    public String toString() {
        return "#" + index;
    }
}
