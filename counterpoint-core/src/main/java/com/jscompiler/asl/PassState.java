package com.jscompiler.asl;

import java.util.Map;

/**
 * Moves data: a constant {@code result}, the value at {@code inputPath}, or a
 * {@code parameters} object, written to {@code resultPath}.
 */
public record PassState(
    String inputPath,
    Map<String, Object> parameters,
    Object result,
    ResultPath resultPath,
    String next,
    Boolean end
) implements State {

    public static PassState to(String next) {
        return new PassState(null, null, null, null, next, next == null ? Boolean.TRUE : null);
    }

    @Override
    public String type() {
        return "Pass";
    }
}
