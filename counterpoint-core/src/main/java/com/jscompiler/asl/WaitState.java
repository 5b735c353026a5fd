package com.jscompiler.asl;

/**
 * Pauses for a number of seconds or until a timestamp; exactly one of the four
 * duration fields is set.
 */
public record WaitState(
    Number seconds,
    String secondsPath,
    String timestamp,
    String timestampPath,
    String next,
    Boolean end
) implements State {

    @Override
    public String type() {
        return "Wait";
    }
}
