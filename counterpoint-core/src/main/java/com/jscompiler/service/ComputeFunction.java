package com.jscompiler.service;

/**
 * A compute function invoked with a single payload argument.
 */
public record ComputeFunction(String name, String functionArn) implements Service {
}
