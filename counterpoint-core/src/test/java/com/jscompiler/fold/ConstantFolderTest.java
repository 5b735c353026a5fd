package com.jscompiler.fold;

import com.jscompiler.CompilationException;
import com.jscompiler.ErrorKind;
import com.jscompiler.ast.UnaryExpression;
import com.jscompiler.service.ExternalReferences;
import com.jscompiler.service.WorkflowOrchestrator;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static com.jscompiler.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

public class ConstantFolderTest {

    private final WorkflowOrchestrator machine =
        new WorkflowOrchestrator("machine", "arn:aws:states:us-east-1:1:stateMachine:m", WorkflowOrchestrator.Type.STANDARD);

    private final ConstantFolder folder = new ConstantFolder(ExternalReferences.of(Map.of(
        "stage", "prod",
        "limits", Map.of("max", 10.0),
        "machine", machine)));

    @Test
    void testLiterals() {
        assertEquals(Optional.of(new Constant("value")), folder.evalToConstant(lit("value")));
        assertEquals(Optional.of(Constant.NULL), folder.evalToConstant(lit(null)));
        assertEquals(Optional.of(Constant.UNDEFINED), folder.evalToConstant(id("undefined")));
        assertEquals(Optional.of(new Constant(3)), folder.evalToConstant(lit(3.0)));
    }

    @Test
    void testNegation() {
        assertEquals(Optional.of(new Constant(-10)), folder.evalToConstant(new UnaryExpression("-", lit(10))));
        assertEquals(Optional.of(new Constant(-1.5)), folder.evalToConstant(new UnaryExpression("-", lit(1.5))));
        assertEquals(Optional.empty(), folder.evalToConstant(new UnaryExpression("-", id("x"))));

        CompilationException error = assertThrows(CompilationException.class,
            () -> folder.evalToConstant(new UnaryExpression("-", lit("text"))));
        assertEquals(ErrorKind.TYPE_MISMATCH, error.kind());
    }

    @Test
    void testExternalReferences() {
        assertEquals(Optional.of(new Constant("prod")), folder.evalToConstant(ref("stage")));
        assertEquals(10.0, folder.evalToConstant(member(ref("limits"), "max")).orElseThrow().value());
        assertEquals(Optional.empty(), folder.evalToConstant(member(ref("limits"), "min")));
    }

    @Test
    void testPropertyOfOpaqueHandle() {
        Optional<Constant> arn = folder.evalToConstant(member(ref("machine"), "stateMachineArn"));

        assertEquals("arn:aws:states:us-east-1:1:stateMachine:m", arn.orElseThrow().value());
        assertFalse(folder.evalToConstant(ref("machine")).orElseThrow().isPrimitive());
    }

    @Test
    void testUnresolvedReference() {
        CompilationException error = assertThrows(CompilationException.class,
            () -> folder.evalToConstant(ref("missing")));
        assertEquals(ErrorKind.INVALID_REFERENCE, error.kind());
    }

    @Test
    void testNonConstants() {
        assertEquals(Optional.empty(), folder.evalToConstant(id("x")));
        assertEquals(Optional.empty(), folder.evalToConstant(call(id("f"))));
    }

    @Test
    void testStringConversion() {
        assertEquals("null", Constant.NULL.asString());
        assertEquals("undefined", Constant.UNDEFINED.asString());
        assertEquals("1.5", new Constant(1.5).asString());
        assertEquals("2", new Constant(2.0).asString());
        assertEquals("a,,1", new Constant(java.util.Arrays.asList("a", null, 1)).asString());
        assertEquals("[object Object]", new Constant(Map.of()).asString());
    }
}
