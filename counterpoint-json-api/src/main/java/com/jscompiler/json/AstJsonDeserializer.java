package com.jscompiler.json;

import com.jscompiler.ast.FunctionDeclaration;
import com.jscompiler.ast.Node;

/**
 * Reads function ASTs handed over by the front end.
 */
public interface AstJsonDeserializer {

    /**
     * Deserializes the root handed to the compiler: a function, or the error node the
     * front end produced in its place.
     *
     * @throws AstJsonException if the JSON is not a node
     */
    Node deserializeRoot(String json) throws AstJsonException;

    /**
     * @throws AstJsonException if the JSON is not a function declaration
     */
    FunctionDeclaration deserializeFunction(String json) throws AstJsonException;

    /**
     * Deserializes a JSON string to a specific AST node type.
     *
     * @param json the JSON string to deserialize
     * @param type the expected node type
     * @param <T> the node type
     * @return the deserialized node
     * @throws AstJsonException if deserialization fails
     */
    <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException;
}
