package com.jscompiler.asl;

import java.util.List;
import java.util.Map;

public record TaskState(
    String resource,
    String inputPath,
    Map<String, Object> parameters,  // Can be null
    ResultPath resultPath,           // Can be null
    List<CatchRule> catchRules,      // Can be null
    String next,
    Boolean end
) implements State {

    @Override
    public String type() {
        return "Task";
    }
}
