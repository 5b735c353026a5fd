package com.jscompiler.asl;

import java.util.List;
import java.util.Map;

public record MapState(
    Integer maxConcurrency,  // Can be null for the orchestrator's default
    StateMachine iterator,
    String itemsPath,
    Map<String, Object> parameters,
    ResultPath resultPath,
    List<CatchRule> catchRules,
    String next,
    Boolean end
) implements State {

    @Override
    public String type() {
        return "Map";
    }
}
