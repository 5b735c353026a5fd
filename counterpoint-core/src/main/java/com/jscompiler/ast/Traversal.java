package com.jscompiler.ast;

/**
 * Search order for {@link SyntaxTree#contains(Node, Node, Traversal)}.
 */
public enum Traversal {
    DEPTH_FIRST,
    BREADTH_FIRST
}
