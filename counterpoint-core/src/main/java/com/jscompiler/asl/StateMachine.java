package com.jscompiler.asl;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A state graph: a start state and the named states reachable from it. Also the shape
 * of a Map iterator and of each Parallel branch.
 */
public record StateMachine(String startAt, Map<String, State> states) {

    public StateMachine {
        states = Collections.unmodifiableMap(new LinkedHashMap<>(states));
    }

    public State state(String name) {
        return states.get(name);
    }
}
