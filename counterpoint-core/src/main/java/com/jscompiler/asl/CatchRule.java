package com.jscompiler.asl;

import java.util.List;

/**
 * Routes errors raised by a Task, Map or Parallel state to a handler state.
 */
public record CatchRule(List<String> errorEquals, ResultPath resultPath, String next) {

    public static final String ALL_ERRORS = "States.ALL";

    public static CatchRule all(ResultPath resultPath, String next) {
        return new CatchRule(List.of(ALL_ERRORS), resultPath, next);
    }
}
