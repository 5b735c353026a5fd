package com.jscompiler.fold;

import java.util.ArrayList;
import java.util.List;

/**
 * A chain of property accesses off a named root: {@code a.b[0].c} is identity
 * {@code a} with reference {@code ["b", 0, "c"]}. Keys are {@link String}s or
 * {@link Number}s.
 */
public record ReferencePath(String identity, List<Object> reference) {

    public ReferencePath {
        reference = List.copyOf(reference);
    }

    public ReferencePath append(Object key) {
        List<Object> extended = new ArrayList<>(reference);
        extended.add(key);
        return new ReferencePath(identity, extended);
    }

    public int depth() {
        return reference.size();
    }
}
