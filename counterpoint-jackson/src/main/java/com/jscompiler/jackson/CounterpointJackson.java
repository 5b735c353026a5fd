package com.jscompiler.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for ObjectMapper instances that read function ASTs and write compiled
 * artifacts.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = CounterpointJackson.createObjectMapper();
 * FunctionDeclaration function = mapper.readValue(json, FunctionDeclaration.class);
 * String definition = mapper.writeValueAsString(stateMachine);
 * </pre>
 */
public final class CounterpointJackson {

    private CounterpointJackson() {
        // Utility class
    }

    /**
     * The returned mapper:
     * - Handles polymorphic Node types via the "type" property
     * - Omits absent (null) fields, except null literals and discarded result paths
     * - Uses JavaScript-compatible number serialization
     * - Writes states in the orchestrator's definition format
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        // Succeed states have no fields besides their type
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

        // Front ends may attach extra properties (comments, ranges) to nodes
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new AstModule());

        return mapper;
    }
}
