package com.jscompiler.event;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The input handed to an event rule's target. Either {@code input} is set, a JSON
 * document known at compile time, or {@code inputPaths} and {@code inputTemplate} are,
 * the template referencing each path through its {@code <placeholder>}.
 */
public record InputTransform(String input, Map<String, String> inputPaths, String inputTemplate) {

    public InputTransform {
        inputPaths = inputPaths == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(inputPaths));
    }

    public static InputTransform constant(String input) {
        return new InputTransform(input, null, null);
    }

    public boolean isConstant() {
        return input != null;
    }
}
