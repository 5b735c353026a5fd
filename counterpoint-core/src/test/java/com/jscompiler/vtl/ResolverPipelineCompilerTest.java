package com.jscompiler.vtl;

import com.jscompiler.CompilationException;
import com.jscompiler.CompilerOptions;
import com.jscompiler.ErrorKind;
import com.jscompiler.ast.FunctionDeclaration;
import com.jscompiler.service.CompilationNamespace;
import com.jscompiler.service.ComputeFunction;
import com.jscompiler.service.ExternalReferences;
import com.jscompiler.service.KeyValueStore;
import com.jscompiler.service.WorkflowOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.jscompiler.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

public class ResolverPipelineCompilerTest {

    private static final KeyValueStore TABLE = new KeyValueStore("people", "people-table");
    private static final ComputeFunction LOOKUP =
        new ComputeFunction("lookup", "arn:aws:lambda:us-east-1:1:function:lookup");
    private static final WorkflowOrchestrator MACHINE = new WorkflowOrchestrator("machine",
        "arn:aws:states:us-east-1:1:stateMachine:machine", WorkflowOrchestrator.Type.EXPRESS);

    private CompilationNamespace namespace;
    private ResolverPipelineCompiler compiler;

    @BeforeEach
    void setUp() {
        namespace = new CompilationNamespace("api");
        compiler = new ResolverPipelineCompiler(namespace,
            ExternalReferences.of(Map.of("table", TABLE, "lookup", LOOKUP, "machine", MACHINE, "prefix", "hello ")),
            CompilerOptions.defaults());
    }

    private ResolverPipeline compile(FunctionDeclaration function) {
        return compiler.compile(function);
    }

    @Test
    void testUnitResolver() {
        ResolverPipeline resolver = compile(fn(List.of("context", "name"),
            ret(template(lit("hello "), id("name")))));

        assertFalse(resolver.isPipeline());
        assertEquals("None", resolver.dataSource().name());
        assertEquals("""
            {
              "version": "2018-05-29",
              "payload": null
            }""", resolver.requestTemplate());
        assertEquals("""
            #set($v1 = "hello ${context.arguments.name}")
            #return($v1)""", resolver.responseTemplate());
        assertEquals(List.of(resolver.requestTemplate(), resolver.responseTemplate()), resolver.templates());
    }

    @Test
    void testExternalConstantsAreInlined() {
        ResolverPipeline resolver = compile(fn(List.of("context"),
            decl("greeting", ref("prefix")),
            ret(id("greeting"))));

        assertEquals("""
            #set($context.stash.greeting = "hello ")
            #return($context.stash.greeting)""", resolver.responseTemplate());
    }

    @Test
    void testThrowEndsWithNullReturn() {
        ResolverPipeline resolver = compile(fn(List.of("context"), raise("NotFoundError", "missing")));

        assertEquals("""
            $util.error("missing", "NotFoundError")
            #return($null)""", resolver.responseTemplate());
    }

    @Test
    void testMapCallback() {
        ResolverPipeline resolver = compile(fn(List.of("context"),
            ret(call(member(path("context", "arguments", "items"), "map"),
                arrow(List.of("item"), ret(member(id("item"), "name")))))));

        assertEquals("""
            #set($v1 = [])
            #foreach($item in $context.arguments.items)
            $util.qr($v1.add($item.name))
            #end
            #return($v1)""", resolver.responseTemplate());
    }

    @Test
    void testTableStage() {
        ResolverPipeline resolver = compile(fn(List.of("context", "id"),
            decl("person", call(member(ref("table"), "getItem"), obj("key", obj("id", id("id"))))),
            ret(member(id("person"), "Item"))));

        assertTrue(resolver.isPipeline());
        assertNull(resolver.dataSource());
        assertEquals("{}", resolver.requestTemplate());

        PipelineStage stage = resolver.stages().get(0);
        assertEquals("people_getItem", stage.name());
        assertEquals("peopleDataSource", stage.dataSource().name());
        assertEquals(DataSourceKind.KEY_VALUE_STORE, stage.dataSource().kind());
        assertEquals(VtlTemplate.CIRCUIT_BREAKER + "\n" + """
            #set($v1 = {})
            #set($v2 = {})
            $util.qr($v2.put("id", $context.arguments.id))
            $util.qr($v1.put("key", $v2))
            $util.qr($v1.put("version", "2018-05-29"))
            $util.qr($v1.put("operation", "GetItem"))
            $util.toJson($v1)""", stage.requestTemplate());
        assertEquals("""
            #set( $context.stash.person = $context.result )
            {}""", stage.responseTemplate());

        assertEquals(VtlTemplate.CIRCUIT_BREAKER + "\n#return($context.stash.person.Item)",
            resolver.responseTemplate());
        assertEquals(List.of("{}", stage.requestTemplate(), stage.responseTemplate(), resolver.responseTemplate()),
            resolver.templates());
    }

    @Test
    void testReturnedFunctionInvocation() {
        ResolverPipeline resolver = compile(fn(List.of("context"),
            ret(member(call(ref("lookup"), obj("a", lit(1))), "body"))));

        PipelineStage stage = resolver.stages().get(0);
        assertEquals("lookup", stage.name());
        assertEquals(DataSourceKind.COMPUTE_FUNCTION, stage.dataSource().kind());
        assertTrue(stage.requestTemplate().contains("""
            {
              "version": "2018-05-29",
              "operation": "Invoke",
              "payload": $util.toJson($v1)
            }"""));
        assertEquals("""
            #set( $context.stash.return__flag = true )
            #set( $context.stash.return__val = $context.result.body )
            {}""", stage.responseTemplate());
        assertEquals(VtlTemplate.CIRCUIT_BREAKER, resolver.responseTemplate());
    }

    @Test
    void testWorkflowStart() {
        ResolverPipeline resolver = compile(fn(List.of("context"),
            decl("exec", call(ref("machine"), obj("input", obj("id", lit("1"))))),
            ret(member(id("exec"), "output"))));

        PipelineStage stage = resolver.stages().get(0);
        assertEquals(DataSourceKind.HTTP, stage.dataSource().kind());
        assertEquals("https://sync-states.us-east-1.amazonaws.com/", stage.dataSource().endpoint());
        assertTrue(stage.requestTemplate().contains("\"x-amz-target\": \"AWSStepFunctions.StartSyncExecution\""));
        assertTrue(stage.requestTemplate().contains(
            "$util.qr($v1.put(\"stateMachineArn\", \"arn:aws:states:us-east-1:1:stateMachine:machine\"))"));
        assertTrue(stage.responseTemplate().startsWith("#if($context.result.statusCode == 200)"));
        assertTrue(stage.responseTemplate().endsWith("#set( $context.stash.exec = $sfn__result )\n{}"));
    }

    @Test
    void testNamespaceIsSharedAcrossResolvers() {
        PipelineStage first = compile(fn(List.of("context"),
            stmt(call(member(ref("table"), "putItem"), obj("key", lit("a")))))).stages().get(0);
        PipelineStage second = compile(fn(List.of("context"),
            stmt(call(member(ref("table"), "putItem"), obj("key", lit("b")))))).stages().get(0);

        assertEquals("people_putItem", first.name());
        assertEquals("people_putItem_0", second.name());
        assertSame(first.dataSource(), second.dataSource());
        assertEquals(1, namespace.dataSourceCount());
    }

    @Test
    void testStateMachineIntrinsicsAreRejected() {
        CompilationException error = assertThrows(CompilationException.class, () -> compile(fn(List.of("context"),
            stmt(call(member(id("$SFN"), "waitFor"), lit(1))),
            ret(lit(null)))));
        assertEquals(ErrorKind.CONTEXT_MISMATCH, error.kind());
    }

    @Test
    void testServiceCallInsideExpression() {
        CompilationException error = assertThrows(CompilationException.class, () -> compile(fn(List.of("context"),
            ret(binary(call(ref("lookup")), "+", lit(1))))));
        assertEquals(ErrorKind.UNSUPPORTED_CALL_POSITION, error.kind());
    }

    @Test
    void testUnsupportedTableOperation() {
        CompilationException error = assertThrows(CompilationException.class, () -> compile(fn(List.of("context"),
            stmt(call(member(ref("table"), "batchGetItem"), obj())))));
        assertEquals(ErrorKind.UNSUPPORTED_SERVICE, error.kind());
    }

    @Test
    void testUnboundName() {
        CompilationException error = assertThrows(CompilationException.class, () -> compile(fn(List.of("context"),
            ret(id("nobody")))));
        assertEquals(ErrorKind.INVALID_REFERENCE, error.kind());
    }
}
