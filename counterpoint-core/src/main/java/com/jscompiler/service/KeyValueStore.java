package com.jscompiler.service;

import java.util.Set;

/**
 * A key-value table. Calls take the shape {@code table.getItem({...})}.
 */
public record KeyValueStore(String name, String tableName) implements Service {

    public static final Set<String> METHODS = Set.of("getItem", "putItem", "updateItem", "deleteItem", "query", "scan");

    /**
     * @return the request operation name for a table method, e.g. {@code GetItem}
     */
    public static String operationOf(String method) {
        return Character.toUpperCase(method.charAt(0)) + method.substring(1);
    }
}
