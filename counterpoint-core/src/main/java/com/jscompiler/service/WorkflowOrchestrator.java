package com.jscompiler.service;

/**
 * A state machine started with {@code machine({ input, name, traceHeader })}.
 */
public record WorkflowOrchestrator(String name, String stateMachineArn, Type type) implements Service {

    public enum Type {
        STANDARD,
        EXPRESS
    }

    public boolean isExpress() {
        return type == Type.EXPRESS;
    }
}
