package com.jscompiler.fold;

import com.jscompiler.util.JsNumbers;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A value known at compile time. The wrapper tells a folded {@code undefined}
 * ({@link Undefined#VALUE}) or {@code null} apart from "not a constant", which is an
 * empty {@link java.util.Optional}.
 */
public record Constant(Object value) {

    public static final Constant UNDEFINED = new Constant(Undefined.VALUE);
    public static final Constant NULL = new Constant(null);

    public boolean isPrimitive() {
        return value == null || value instanceof String || value instanceof Number
            || value instanceof Boolean || value == Undefined.VALUE;
    }

    /**
     * @return the value converted the way string concatenation converts it
     */
    public String asString() {
        return toJsString(value);
    }

    static String toJsString(Object value) {
        if (value == null) {
            return "null";
        } else if (value instanceof Number n) {
            return JsNumbers.format(n);
        } else if (value instanceof List<?> list) {
            return list.stream()
                .map(v -> v == null || v == Undefined.VALUE ? "" : toJsString(v))
                .collect(Collectors.joining(","));
        } else if (value instanceof Map<?, ?>) {
            return "[object Object]";
        }
        return String.valueOf(value);
    }
}
