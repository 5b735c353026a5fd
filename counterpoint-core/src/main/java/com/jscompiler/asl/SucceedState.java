package com.jscompiler.asl;

public record SucceedState() implements State {

    @Override
    public String type() {
        return "Succeed";
    }
}
