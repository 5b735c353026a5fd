package com.jscompiler.fold;

import com.jscompiler.CompilationException;
import com.jscompiler.ErrorKind;
import com.jscompiler.ast.Expression;
import com.jscompiler.ast.Identifier;
import com.jscompiler.ast.Literal;
import com.jscompiler.ast.MemberExpression;
import com.jscompiler.ast.ObjectExpression;
import com.jscompiler.ast.Property;
import com.jscompiler.ast.SpreadElement;
import com.jscompiler.service.ExternalReferences;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.jscompiler.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

public class ExpressionFlattenerTest {

    private final ExpressionFlattener flattener =
        new ExpressionFlattener(new ConstantFolder(ExternalReferences.of(Map.of("suffix", "!"))));

    @Test
    void testSubstitutesBoundNames() {
        Expression result = flattener.flattenReturnEvent(List.of(
            decl("obj", obj("val", lit("hi"))),
            ret(binary(path("obj", "val"), "+", lit(" there")))));

        assertEquals(binary(lit("hi"), "+", lit(" there")), result);
    }

    @Test
    void testUnboundNamesAreKept() {
        Expression result = flattener.flattenExpression(path("event", "detail", "id"), Map.of());

        assertEquals(path("event", "detail", "id"), result);
    }

    @Test
    void testFlatteningConstantsIsIdempotent() {
        Expression input = obj("list", array(lit(1), lit("two")), "text", template(lit("a"), lit("b")));

        Expression once = flattener.flattenExpression(input, Map.of());
        assertEquals(once, flattener.flattenExpression(once, Map.of()));
    }

    @Test
    void testArrayAccess() {
        Map<String, Expression> scope = flattener.flattenStatementsScope(List.of(
            decl("items", array(lit("a"), lit("b")))));

        assertEquals(lit("b"), flattener.flattenExpression(
            MemberExpression.element(id("items"), lit(1)), scope));
        assertEquals(id("undefined"), flattener.flattenExpression(
            MemberExpression.element(id("items"), lit(5)), scope));

        CompilationException error = assertThrows(CompilationException.class,
            () -> flattener.flattenExpression(member(id("items"), "length"), scope));
        assertEquals(ErrorKind.INVALID_ACCESS, error.kind());
    }

    @Test
    void testMissingProperty() {
        Map<String, Expression> scope = flattener.flattenStatementsScope(List.of(
            decl("obj", obj("a", lit(1), "b", lit(2)))));

        CompilationException error = assertThrows(CompilationException.class,
            () -> flattener.flattenExpression(path("obj", "c"), scope));
        assertEquals(ErrorKind.PROPERTY_NOT_FOUND, error.kind());
        assertTrue(error.getMessage().contains("a,b"));
    }

    @Test
    void testUninitializedName() {
        Map<String, Expression> scope = flattener.flattenStatementsScope(List.of(decl("later", null)));

        CompilationException error = assertThrows(CompilationException.class,
            () -> flattener.flattenExpression(id("later"), scope));
        assertEquals(ErrorKind.INVALID_REFERENCE, error.kind());
    }

    @Test
    void testSpreads() {
        Map<String, Expression> scope = flattener.flattenStatementsScope(List.of(
            decl("base", obj("a", lit(1))),
            decl("list", array(lit(1), lit(2)))));

        Expression merged = flattener.flattenExpression(new ObjectExpression(List.of(
            new SpreadElement(id("base")), Property.of("b", lit(2)))), scope);
        assertEquals(obj("a", lit(1), "b", lit(2)), merged);

        Expression joined = flattener.flattenExpression(array(new SpreadElement(id("list")), lit(3)), scope);
        assertEquals(array(lit(1), lit(2), lit(3)), joined);

        CompilationException error = assertThrows(CompilationException.class,
            () -> flattener.flattenExpression(array(new SpreadElement(id("base"))), scope));
        assertEquals(ErrorKind.UNSUPPORTED_SPREAD, error.kind());
    }

    @Test
    void testLaterPropertyOverridesSpread() {
        Expression merged = new ObjectExpression(List.of(
            new SpreadElement(obj("a", lit(1))), Property.of("a", lit(2))));

        assertEquals(lit(2), flattener.flattenExpression(member(merged, "a"), Map.of()));
    }

    @Test
    void testComputedKeysMustFoldToStrings() {
        Expression computed = new ObjectExpression(List.of(
            new Property(0, 0, lit("key"), lit(1), true)));
        ObjectExpression flattened = (ObjectExpression) flattener.flattenExpression(computed, Map.of());
        assertEquals("key", ((Property) flattened.properties().get(0)).staticKey());

        Expression numeric = new ObjectExpression(List.of(new Property(0, 0, lit(1), lit(1), true)));
        CompilationException error = assertThrows(CompilationException.class,
            () -> flattener.flattenExpression(numeric, Map.of()));
        assertEquals(ErrorKind.TYPE_MISMATCH, error.kind());
    }

    @Test
    void testTemplatesCollapseWhenConstant() {
        Expression folded = flattener.flattenExpression(template(lit("hello "), ref("suffix")), Map.of());
        assertEquals(new Literal("hello !"), folded);

        Expression kept = flattener.flattenExpression(template(lit("hello "), id("name")), Map.of());
        assertEquals(template(lit("hello "), id("name")), kept);
    }

    @Test
    void testMissingReturn() {
        CompilationException error = assertThrows(CompilationException.class,
            () -> flattener.flattenReturnEvent(List.of(decl("x", lit(1)))));
        assertEquals(ErrorKind.MISSING_RETURN, error.kind());
    }

    @Test
    void testReferencePath() {
        Optional<ReferencePath> path = flattener.getReferencePath(
            MemberExpression.element(path("event", "detail", "items"), lit(0)));

        assertEquals(new ReferencePath("event", List.of("detail", "items", 0)), path.orElseThrow());
        assertEquals(3, path.get().depth());
        assertEquals(Optional.empty(), flattener.getReferencePath(call(id("f"))));
        assertEquals(new ReferencePath("x", List.of()), flattener.getReferencePath(new Identifier("x")).orElseThrow());
    }
}
