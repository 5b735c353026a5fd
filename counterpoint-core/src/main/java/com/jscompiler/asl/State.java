package com.jscompiler.asl;

/**
 * A node of a state graph. Successor wiring is explicit: {@code next} names the
 * following state, {@code end} marks a state that finishes its graph.
 */
public sealed interface State
    permits TaskState, WaitState, MapState, ParallelState, PassState, ChoiceState, SucceedState, FailState {

    /**
     * @return the orchestrator's type name, e.g. {@code "Task"}
     */
    String type();
}
