package com.jscompiler.service;

import com.jscompiler.CompilationException;
import com.jscompiler.ErrorKind;
import com.jscompiler.ast.ReferenceExpression;

import java.util.HashMap;
import java.util.Map;

/**
 * Resolves {@link ReferenceExpression}s to the values they denote once infrastructure
 * is wired: a {@link Service}, a primitive (string, number, boolean, null) or an
 * opaque handle.
 */
@FunctionalInterface
public interface ExternalReferences {

    Object resolve(ReferenceExpression reference);

    /**
     * Resolves references by name from a fixed table.
     */
    static ExternalReferences of(Map<String, ?> values) {
        Map<String, Object> table = new HashMap<>(values);
        return reference -> {
            if (!table.containsKey(reference.name())) {
                throw new CompilationException(ErrorKind.INVALID_REFERENCE,
                    "unresolved external reference '" + reference.name() + "'", reference);
            }
            return table.get(reference.name());
        };
    }

    static ExternalReferences none() {
        return of(Map.of());
    }
}
