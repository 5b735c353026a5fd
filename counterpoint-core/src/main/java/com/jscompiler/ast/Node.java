package com.jscompiler.ast;

/**
 * Base interface for all nodes of a function's syntax tree.
 *
 * <p>Nodes are immutable records. Structural relations (owner, children, statement
 * siblings) are not stored on the node; they live in a {@link SyntaxTree} built over
 * the root.</p>
 */
public sealed interface Node permits
    Statement,
    Expression,
    Declaration,
    ErrorNode {

    String type();
    int start();
    int end();
    NodeKind nodeKind();
}
