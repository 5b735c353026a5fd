package com.jscompiler.ast;

public record TryStatement(
    int start,
    int end,
    BlockStatement block,
    CatchClause handler,      // Can be null
    BlockStatement finalizer  // Can be null
) implements Statement {
    public TryStatement(BlockStatement block, CatchClause handler, BlockStatement finalizer) {
        this(0, 0, block, handler, finalizer);
    }

    @Override
    public String type() {
        return "TryStatement";
    }
}
