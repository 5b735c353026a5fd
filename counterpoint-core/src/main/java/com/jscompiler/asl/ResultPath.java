package com.jscompiler.asl;

/**
 * Where a state writes its result. {@link #DISCARD} serializes as JSON {@code null},
 * which keeps the state's input unchanged.
 */
public record ResultPath(String path) {

    public static final ResultPath DISCARD = new ResultPath(null);
    public static final ResultPath ROOT = new ResultPath("$");

    public static ResultPath of(String path) {
        return new ResultPath(path);
    }

    public boolean isDiscard() {
        return path == null;
    }
}
