package com.jscompiler.asl;

import java.util.List;

public record ParallelState(
    List<StateMachine> branches,
    ResultPath resultPath,
    List<CatchRule> catchRules,
    String next,
    Boolean end
) implements State {

    @Override
    public String type() {
        return "Parallel";
    }
}
