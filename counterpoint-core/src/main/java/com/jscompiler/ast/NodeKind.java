package com.jscompiler.ast;

/**
 * Coarse classification of a {@link Node}.
 */
public enum NodeKind {
    DECLARATION,
    EXPRESSION,
    STATEMENT,
    ERROR
}
