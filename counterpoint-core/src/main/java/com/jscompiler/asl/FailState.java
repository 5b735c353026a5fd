package com.jscompiler.asl;

public record FailState(String error, String cause) implements State {

    @Override
    public String type() {
        return "Fail";
    }
}
