package com.jscompiler;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class CompilerOptionsTest {

    @Test
    void testDefaults() {
        CompilerOptions options = CompilerOptions.fromEnvironment(Map.of());

        assertEquals(CompilerOptions.defaults(), options);
        assertEquals("2018-05-29", options.templateVersion());
        assertEquals("us-east-1", options.region());
        assertEquals(80, options.maxStateNameLength());
    }

    @Test
    void testOverrides() {
        CompilerOptions options = CompilerOptions.fromEnvironment(Map.of(
            CompilerOptions.ENV_TEMPLATE_VERSION, " 2017-02-28 ",
            CompilerOptions.ENV_REGION, "eu-west-1",
            CompilerOptions.ENV_MAX_STATE_NAME_LENGTH, "40"));

        assertEquals("2017-02-28", options.templateVersion());
        assertEquals("eu-west-1", options.region());
        assertEquals(40, options.maxStateNameLength());
    }

    @Test
    void testBlankAndMalformedValuesFallBack() {
        CompilerOptions options = CompilerOptions.fromEnvironment(Map.of(
            CompilerOptions.ENV_REGION, "  ",
            CompilerOptions.ENV_MAX_STATE_NAME_LENGTH, "lots"));

        assertEquals("us-east-1", options.region());
        assertEquals(80, options.maxStateNameLength());
    }

    @Test
    void testStateNameLengthIsClamped() {
        assertEquals(80, CompilerOptions.fromEnvironment(
            Map.of(CompilerOptions.ENV_MAX_STATE_NAME_LENGTH, "500")).maxStateNameLength());
        assertEquals(16, CompilerOptions.fromEnvironment(
            Map.of(CompilerOptions.ENV_MAX_STATE_NAME_LENGTH, "3")).maxStateNameLength());
    }

    @Test
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> new CompilerOptions("", "us-east-1", 80));
        assertThrows(IllegalArgumentException.class, () -> new CompilerOptions("2018-05-29", null, 80));
        assertThrows(IllegalArgumentException.class, () -> new CompilerOptions("2018-05-29", "us-east-1", 2));
    }
}
