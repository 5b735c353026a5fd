package com.jscompiler.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jscompiler.Compiler;
import com.jscompiler.CompilerOptions;
import com.jscompiler.ErrorKind;
import com.jscompiler.CompilationException;
import com.jscompiler.asl.StateMachine;
import com.jscompiler.ast.ErrorNode;
import com.jscompiler.ast.FunctionDeclaration;
import com.jscompiler.ast.Literal;
import com.jscompiler.ast.Node;
import com.jscompiler.ast.ReturnStatement;
import com.jscompiler.json.AstJsonException;
import com.jscompiler.json.AstJsonProvider;
import com.jscompiler.service.ComputeFunction;
import com.jscompiler.service.ExternalReferences;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class JacksonAstJsonProviderTest {

    private static final String HANDLER = """
        {
          "type": "FunctionDeclaration",
          "start": 0,
          "end": 120,
          "name": "handler",
          "params": [{ "type": "Parameter", "name": "input" }],
          "body": {
            "type": "BlockStatement",
            "body": [
              {
                "type": "TryStatement",
                "block": {
                  "type": "BlockStatement",
                  "body": [
                    {
                      "type": "ExpressionStatement",
                      "expression": {
                        "type": "CallExpression",
                        "callee": { "type": "ReferenceExpression", "name": "lookup" },
                        "arguments": [{ "type": "Identifier", "name": "input" }]
                      }
                    }
                  ]
                },
                "handler": {
                  "type": "CatchClause",
                  "body": { "type": "BlockStatement", "body": [] }
                },
                "comments": []
              },
              {
                "type": "IfStatement",
                "test": {
                  "type": "BinaryExpression",
                  "operator": "===",
                  "left": {
                    "type": "MemberExpression",
                    "object": { "type": "Identifier", "name": "input" },
                    "property": { "type": "Identifier", "name": "mode" },
                    "computed": false
                  },
                  "right": { "type": "Literal", "value": "fast" }
                },
                "consequent": {
                  "type": "ReturnStatement",
                  "argument": { "type": "Literal", "value": null }
                }
              }
            ]
          }
        }
        """;

    private final AstJsonProvider provider = AstJsonProvider.getProvider();

    @Test
    void testProviderIsDiscovered() {
        assertTrue(AstJsonProvider.isProviderAvailable());
        assertInstanceOf(JacksonAstJsonProvider.class, provider);
        assertEquals("Jackson", provider.getName());
        assertSame(JacksonAstJsonProvider.class, AstJsonProvider.getProvider("Jackson").getClass());
    }

    @Test
    void testFunctionRoundTrip() throws Exception {
        FunctionDeclaration function = provider.getDeserializer().deserializeFunction(HANDLER);

        assertEquals("handler", function.name());
        assertEquals(120, function.end());
        assertEquals("input", function.params().get(0).name());
        assertEquals(2, function.body().body().size());

        String json = provider.getSerializer().serialize(function);
        assertEquals(function, provider.getDeserializer().deserializeFunction(json));
    }

    @Test
    void testNullLiteralsAreWritten() throws Exception {
        String json = provider.getSerializer().serialize(new ReturnStatement(new Literal(null)));

        JsonNode tree = new ObjectMapper().readTree(json);
        assertEquals("ReturnStatement", tree.get("type").asText());
        assertTrue(tree.get("argument").has("value"));
        assertTrue(tree.get("argument").get("value").isNull());
        assertFalse(tree.get("argument").has("string"));
    }

    @Test
    void testUpstreamErrorNode() throws Exception {
        Node root = provider.getDeserializer().deserializeRoot("""
            { "type": "Err", "message": "Unexpected end of input" }
            """);

        assertEquals(new ErrorNode("Unexpected end of input"), root);

        Compiler compiler = new Compiler("api", ExternalReferences.none(), CompilerOptions.defaults());
        CompilationException error = assertThrows(CompilationException.class,
            () -> compiler.compileStateMachine(root));
        assertEquals(ErrorKind.UPSTREAM_ERROR, error.kind());
    }

    @Test
    void testMalformedInput() {
        assertThrows(AstJsonException.class, () -> provider.getDeserializer().deserializeRoot("{ \"type\": \"Nope\" }"));
    }

    @Test
    void testStateMachineDefinition() throws Exception {
        FunctionDeclaration function = provider.getDeserializer().deserializeFunction(HANDLER);
        Compiler compiler = new Compiler("api",
            ExternalReferences.of(Map.of("lookup", new ComputeFunction("lookup", "arn:aws:lambda:us-east-1:1:function:lookup"))),
            CompilerOptions.defaults());
        StateMachine machine = compiler.compileStateMachine(function);

        String json = provider.getSerializer().serializeStateMachine(machine);
        assertTrue(json.contains("\"ResultPath\" : null"));

        JsonNode definition = new ObjectMapper().readTree(json);
        assertEquals("Initialize input", definition.get("StartAt").asText());

        JsonNode states = definition.get("States");
        assertEquals("Pass", states.get("Initialize input").get("Type").asText());
        assertEquals("$", states.get("Initialize input").get("Parameters").get("input.$").asText());

        JsonNode task = states.get("lookup(input)");
        assertEquals("Task", task.get("Type").asText());
        assertEquals("$.input", task.get("InputPath").asText());
        assertEquals("States.ALL", task.get("Catch").get(0).get("ErrorEquals").get(0).asText());
        assertEquals("if(input.mode === \"fast\")", task.get("Next").asText());
        assertFalse(task.has("End"));

        JsonNode choice = states.get("if(input.mode === \"fast\")");
        assertEquals("Choice", choice.get("Type").asText());
        assertEquals("$.input.mode", choice.get("Choices").get(0).get("Variable").asText());
        assertEquals("fast", choice.get("Choices").get(0).get("StringEquals").asText());
        assertEquals("Done", choice.get("Default").asText());
        assertEquals("Succeed", states.get("Done").get("Type").asText());

        JsonNode result = states.get("return null");
        assertEquals("Pass", result.get("Type").asText());
        assertTrue(result.get("Result").isNull());
        assertTrue(result.get("End").asBoolean());
    }
}
