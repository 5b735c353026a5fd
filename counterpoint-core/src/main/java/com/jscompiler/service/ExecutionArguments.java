package com.jscompiler.service;

import com.jscompiler.CompilationException;
import com.jscompiler.ErrorKind;
import com.jscompiler.ast.CallExpression;
import com.jscompiler.ast.Expression;
import com.jscompiler.ast.ObjectExpression;
import com.jscompiler.ast.Property;

/**
 * The arguments of a workflow start: {@code machine({ input, name, traceHeader })}.
 * Each is null when not given.
 */
public record ExecutionArguments(Expression input, Expression name, Expression traceHeader) {

    /**
     * @throws CompilationException of kind {@link ErrorKind#INVALID_ARGUMENT} unless the
     *                              call has a single inline object argument without
     *                              spread or computed keys
     */
    public static ExecutionArguments of(CallExpression call) {
        if (!(call.argument(0) instanceof ObjectExpression object)) {
            throw new CompilationException(ErrorKind.INVALID_ARGUMENT,
                "a workflow must be started with a single inline object argument; variable references are not supported",
                call);
        }
        for (Expression member : object.properties()) {
            if (!(member instanceof Property property) || property.computed()) {
                throw new CompilationException(ErrorKind.INVALID_ARGUMENT,
                    "a workflow must be started with an inline object without computed or spread keys", member);
            }
        }
        return new ExecutionArguments(valueOf(object, "input"), valueOf(object, "name"), valueOf(object, "traceHeader"));
    }

    private static Expression valueOf(ObjectExpression object, String key) {
        Property property = object.getProperty(key);
        return property == null ? null : property.value();
    }
}
