package com.jscompiler.event;

import com.jscompiler.CompilationException;
import com.jscompiler.ErrorKind;
import com.jscompiler.ast.FunctionDeclaration;
import com.jscompiler.service.ExternalReferences;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.jscompiler.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

public class InputTransformCompilerTest {

    private final InputTransformCompiler compiler =
        new InputTransformCompiler(ExternalReferences.of(Map.of("stage", "prod")));

    private InputTransform compile(FunctionDeclaration function) {
        return compiler.compile(function);
    }

    @Test
    void testPathsAndTemplate() {
        InputTransform transform = compile(fn(List.of("event"),
            decl("name", path("event", "detail", "name")),
            ret(obj(
                "greeting", template(lit("hello "), id("name")),
                "source", path("event", "source")))));

        assertFalse(transform.isConstant());
        assertEquals(Map.of("detail_name", "$.detail.name", "source", "$.source"), transform.inputPaths());
        assertEquals("{\"greeting\": \"hello <detail_name>\", \"source\": <source>}", transform.inputTemplate());
    }

    @Test
    void testConstantInput() {
        InputTransform transform = compile(fn(List.of("event"),
            ret(obj("a", lit(1), "skipped", id("undefined"), "stage", ref("stage"), "quote", lit("say \"hi\"")))));

        assertTrue(transform.isConstant());
        assertEquals("{\"a\": 1, \"stage\": \"prod\", \"quote\": \"say \\\"hi\\\"\"}", transform.input());
        assertNull(transform.inputPaths());
    }

    @Test
    void testControlCharactersAreEscaped() {
        InputTransform transform = compile(fn(List.of("event"),
            ret(obj("line", lit("a\r\nb\u0001")))));

        assertEquals("{\"line\": \"a\\r\\nb\\u0001\"}", transform.input());
    }

    @Test
    void testPlaceholdersAreSharedAndDeduplicated() {
        InputTransform transform = compile(fn(List.of("event"),
            ret(array(
                path("event", "detail", "a_b"),
                path("event", "detail", "a", "b"),
                path("event", "detail", "a_b")))));

        assertEquals("[<detail_a_b>, <detail_a_b_1>, <detail_a_b>]", transform.inputTemplate());
        assertEquals(Map.of("detail_a_b", "$.detail.a_b", "detail_a_b_1", "$.detail.a.b"), transform.inputPaths());
    }

    @Test
    void testRuleContext() {
        InputTransform transform = compile(fn(List.of("event", "$utils"),
            ret(obj("rule", path("$utils", "context", "ruleName")))));

        assertFalse(transform.isConstant());
        assertTrue(transform.inputPaths().isEmpty());
        assertEquals("{\"rule\": <aws.events.rule-name>}", transform.inputTemplate());

        CompilationException error = assertThrows(CompilationException.class, () -> compile(fn(
            List.of("event", "$utils"), ret(obj("rule", path("$utils", "context", "region"))))));
        assertEquals(ErrorKind.INVALID_REFERENCE, error.kind());
    }

    @Test
    void testInvalidReferences() {
        CompilationException deep = assertThrows(CompilationException.class, () -> compile(fn(
            List.of("event"), ret(obj("x", path("event", "source", "name"))))));
        assertEquals(ErrorKind.INVALID_REFERENCE, deep.kind());

        CompilationException unknown = assertThrows(CompilationException.class, () -> compile(fn(
            List.of("event"), ret(obj("x", id("other"))))));
        assertEquals(ErrorKind.INVALID_REFERENCE, unknown.kind());
    }

    @Test
    void testRejectedFunctions() {
        assertEquals(ErrorKind.INVALID_ARGUMENT, assertThrows(CompilationException.class,
            () -> compile(fn(List.of(), ret(lit(1))))).kind());
        assertEquals(ErrorKind.MISSING_RETURN, assertThrows(CompilationException.class,
            () -> compile(fn(List.of("event"), decl("x", lit(1))))).kind());
        assertEquals(ErrorKind.UNSUPPORTED_SYNTAX, assertThrows(CompilationException.class,
            () -> compile(fn(List.of("event"), ret(obj("x", call(id("f"))))))).kind());
    }
}
