package com.jscompiler.asl;

/**
 * An explicit JSON {@code null} inside state parameters or results, where a Java
 * {@code null} would mean "absent".
 */
public final class JsonNull {

    public static final JsonNull INSTANCE = new JsonNull();

    private JsonNull() {
    }

    @Override
    public String toString() {
        return "null";
    }
}
