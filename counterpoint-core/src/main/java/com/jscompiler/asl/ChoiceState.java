package com.jscompiler.asl;

import java.util.List;
import java.util.Map;

/**
 * Branches on the first matching rule. Each rule is a condition object carrying its
 * own {@code Next}.
 */
public record ChoiceState(List<Map<String, Object>> choices, String defaultState) implements State {

    @Override
    public String type() {
        return "Choice";
    }
}
