package com.jscompiler.fold;

/**
 * The JavaScript {@code undefined} value, kept apart from {@code null}.
 */
public enum Undefined {
    VALUE;

    @Override
    public String toString() {
        return "undefined";
    }
}
