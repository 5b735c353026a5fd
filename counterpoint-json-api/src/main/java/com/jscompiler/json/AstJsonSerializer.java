package com.jscompiler.json;

import com.jscompiler.asl.StateMachine;
import com.jscompiler.ast.Node;

/**
 * Writes function ASTs and compiled state machines as JSON.
 */
public interface AstJsonSerializer {

    /**
     * @throws AstJsonException if serialization fails
     */
    String serialize(Node node) throws AstJsonException;

    String serializePretty(Node node) throws AstJsonException;

    /**
     * Serializes a state machine in the orchestrator's definition format: upper camel
     * case keys, {@code Type} discriminated states and explicit {@code null} result
     * paths for discarded results.
     *
     * @throws AstJsonException if serialization fails
     */
    String serializeStateMachine(StateMachine machine) throws AstJsonException;
}
