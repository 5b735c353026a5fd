package com.jscompiler;

import com.jscompiler.asl.StateMachine;
import com.jscompiler.ast.ErrorNode;
import com.jscompiler.service.ExternalReferences;
import com.jscompiler.service.KeyValueStore;
import com.jscompiler.vtl.ResolverPipeline;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.jscompiler.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

public class CompilerTest {

    private final Compiler compiler = new Compiler("api",
        ExternalReferences.of(Map.of("table", new KeyValueStore("people", "people-table"))),
        CompilerOptions.defaults());

    @Test
    void testUpstreamErrorsAreReported() {
        CompilationException error = assertThrows(CompilationException.class,
            () -> compiler.compileResolver(new ErrorNode("Unexpected token '}'")));

        assertEquals(ErrorKind.UPSTREAM_ERROR, error.kind());
        assertTrue(error.getMessage().startsWith("Unexpected token '}'"));
    }

    @Test
    void testOnlyFunctionsCompile() {
        CompilationException error = assertThrows(CompilationException.class,
            () -> compiler.compileStateMachine(lit(1)));

        assertEquals(ErrorKind.INVALID_ARGUMENT, error.kind());
    }

    @Test
    void testResolversShareTheNamespace() {
        ResolverPipeline first = compiler.compileResolver(fn(List.of("context"),
            ret(call(member(ref("table"), "getItem"), obj("key", lit("a"))))));
        ResolverPipeline second = compiler.compileResolver(fn(List.of("context"),
            ret(call(member(ref("table"), "getItem"), obj("key", lit("b"))))));

        assertEquals("people_getItem", first.stages().get(0).name());
        assertEquals("people_getItem_0", second.stages().get(0).name());
        assertEquals(1, compiler.namespace().dataSourceCount());
    }

    @Test
    void testStateMachineAndTargetInput() {
        StateMachine machine = compiler.compileStateMachine(fn(List.of(), ret(lit("ok"))));
        assertEquals("return \"ok\"", machine.startAt());

        assertEquals("\"ok\"", compiler.compileTargetInput(fn(List.of("event"), ret(lit("ok")))).input());
    }
}
