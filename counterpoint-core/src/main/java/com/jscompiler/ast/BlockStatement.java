package com.jscompiler.ast;

import java.util.List;

public record BlockStatement(
    int start,
    int end,
    List<Statement> body
) implements Statement {
    public BlockStatement(List<Statement> body) {
        this(0, 0, body);
    }

    public boolean isEmpty() {
        return body.isEmpty();
    }

    /**
     * @return the first statement, or null when empty
     */
    public Statement firstStatement() {
        return body.isEmpty() ? null : body.get(0);
    }

    /**
     * @return the last statement, or null when empty
     */
    public Statement lastStatement() {
        return body.isEmpty() ? null : body.get(body.size() - 1);
    }

    @Override
    public String type() {
        return "BlockStatement";
    }
}
