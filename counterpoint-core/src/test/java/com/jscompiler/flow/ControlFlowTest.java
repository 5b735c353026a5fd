package com.jscompiler.flow;

import com.jscompiler.ast.BlockStatement;
import com.jscompiler.ast.CatchClause;
import com.jscompiler.ast.DoWhileStatement;
import com.jscompiler.ast.ExpressionStatement;
import com.jscompiler.ast.FunctionDeclaration;
import com.jscompiler.ast.IfStatement;
import com.jscompiler.ast.ReturnStatement;
import com.jscompiler.ast.SyntaxTree;
import com.jscompiler.ast.ThrowStatement;
import com.jscompiler.ast.TryStatement;
import com.jscompiler.ast.VariableDeclaration;
import com.jscompiler.ast.WhileStatement;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.jscompiler.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

public class ControlFlowTest {

    private static ControlFlow flowOf(FunctionDeclaration function) {
        return new ControlFlow(SyntaxTree.of(function));
    }

    @Test
    void testStepSkipsUninitializedDeclarations() {
        VariableDeclaration declared = decl("x", null);
        ExpressionStatement first = stmt(call(id("work")));
        FunctionDeclaration function = fn(List.of(), declared, first);
        ControlFlow flow = flowOf(function);

        assertSame(first, flow.step(function).orElseThrow());
        assertSame(first, flow.step(declared).orElseThrow());
    }

    @Test
    void testEmptyBlockStepsToItsExit() {
        BlockStatement empty = block();
        ReturnStatement after = ret(lit(1));
        ControlFlow flow = flowOf(fn(List.of(), empty, after));

        assertSame(after, flow.step(empty).orElseThrow());
    }

    @Test
    void testLastStatementExitsTheFunction() {
        ReturnStatement last = ret(lit(1));
        ControlFlow flow = flowOf(fn(List.of(), last));

        assertEquals(Optional.empty(), flow.exit(last));
    }

    @Test
    void testLoopBodyExitsBackToTheLoop() {
        ExpressionStatement body = stmt(call(id("work")));
        WhileStatement loop = new WhileStatement(id("more"), block(body));
        ReturnStatement after = ret(null);
        ControlFlow flow = flowOf(fn(List.of("more"), loop, after));

        assertSame(loop, flow.exit(body).orElseThrow());
        assertSame(after, flow.exit(loop).orElseThrow());
    }

    @Test
    void testDoWhileStepsIntoItsBody() {
        ExpressionStatement body = stmt(call(id("work")));
        DoWhileStatement loop = new DoWhileStatement(block(body), id("more"));
        ControlFlow flow = flowOf(fn(List.of("more"), loop));

        assertSame(body, flow.step(loop).orElseThrow());
        assertSame(loop, flow.exit(body).orElseThrow());
    }

    @Test
    void testIfBranchesExitToTheFollowingStatement() {
        ExpressionStatement then = stmt(call(id("a")));
        ExpressionStatement otherwise = stmt(call(id("b")));
        IfStatement branch = new IfStatement(id("flag"), block(then), block(otherwise));
        ReturnStatement after = ret(null);
        ControlFlow flow = flowOf(fn(List.of("flag"), branch, after));

        assertSame(after, flow.exit(then).orElseThrow());
        assertSame(after, flow.exit(otherwise).orElseThrow());
    }

    @Test
    void testTryBlockExitsThroughFinally() {
        ExpressionStatement attempt = stmt(call(id("attempt")));
        ExpressionStatement cleanup = stmt(call(id("cleanup")));
        ExpressionStatement handle = stmt(call(id("handle")));
        CatchClause handler = new CatchClause(decl("err", null), block(handle));
        TryStatement tryStmt = new TryStatement(block(attempt), handler, block(cleanup));
        ReturnStatement after = ret(null);
        ControlFlow flow = flowOf(fn(List.of(), tryStmt, after));

        assertSame(attempt, flow.step(tryStmt).orElseThrow());
        assertSame(cleanup, flow.exit(attempt).orElseThrow());
        assertSame(cleanup, flow.exit(handle).orElseThrow());
        assertSame(after, flow.exit(cleanup).orElseThrow());
        assertSame(handle, flow.step(handler).orElseThrow());
    }

    @Test
    void testThrowIsRoutedToTheNearestCatch() {
        ThrowStatement failure = raise("Error", "boom");
        CatchClause handler = new CatchClause(decl("err", null), block(ret(id("err"))));
        TryStatement tryStmt = new TryStatement(block(failure), handler, null);
        ControlFlow flow = flowOf(fn(List.of(), tryStmt));

        assertSame(handler, flow.throwTarget(failure).orElseThrow());
    }

    @Test
    void testThrowInsideCatchWithFinallyGoesToFinally() {
        ThrowStatement rethrow = raise("Error", "again");
        BlockStatement cleanup = block(stmt(call(id("cleanup"))));
        TryStatement inner = new TryStatement(block(stmt(call(id("attempt")))),
            new CatchClause(null, block(rethrow)), cleanup);
        ControlFlow flow = flowOf(fn(List.of(), inner));

        assertSame(cleanup, flow.throwTarget(rethrow).orElseThrow());
    }

    @Test
    void testInnerFinallyInterceptsBeforeOuterHandler() {
        ThrowStatement rethrow = raise("Error", "again");
        BlockStatement cleanup = block(stmt(call(id("cleanup"))));
        TryStatement inner = new TryStatement(block(stmt(call(id("attempt")))),
            new CatchClause(null, block(rethrow)), cleanup);
        CatchClause outerHandler = new CatchClause(decl("e", null), block(ret(id("e"))));
        ControlFlow flow = flowOf(fn(List.of(), new TryStatement(block(inner), outerHandler, null)));

        assertSame(cleanup, flow.throwTarget(rethrow).orElseThrow());
        assertSame(outerHandler, flow.findCatchClause(rethrow).orElseThrow());
    }

    @Test
    void testHandlerInsideCatchWinsOverEnclosingFinally() {
        ThrowStatement failure = raise("Error", "boom");
        CatchClause nested = new CatchClause(decl("h", null), block(ret(id("h"))));
        BlockStatement cleanup = block(stmt(call(id("cleanup"))));
        TryStatement middle = new TryStatement(block(stmt(call(id("attempt")))),
            new CatchClause(null, block(new TryStatement(block(failure), nested, null))), cleanup);
        ControlFlow flow = flowOf(fn(List.of(), middle));

        assertSame(nested, flow.throwTarget(failure).orElseThrow());
    }

    @Test
    void testUncaughtThrowHasNoTarget() {
        ThrowStatement failure = raise("Error", "boom");
        ControlFlow flow = flowOf(fn(List.of(), failure));

        assertTrue(flow.throwTarget(failure).isEmpty());
    }

    @Test
    void testTerminality() {
        IfStatement bothReturn = new IfStatement(id("flag"), block(ret(lit(1))), block(raise("Error", "no")));
        IfStatement oneSided = new IfStatement(id("flag"), block(ret(lit(1))), null);
        ControlFlow flow = flowOf(fn(List.of("flag"), oneSided, bothReturn));

        assertTrue(flow.isTerminal(bothReturn));
        assertFalse(flow.isTerminal(oneSided));
    }

    @Test
    void testVisibleNamesAreThoseDeclaredBefore() {
        VariableDeclaration a = decl("a", lit(1));
        ExpressionStatement use = stmt(call(id("work"), id("a")));
        VariableDeclaration b = decl("b", lit(2));
        ControlFlow flow = flowOf(fn(List.of("input"), a, use, b));

        assertEquals(List.of("input", "a"), flow.getVisibleNames(use));
        assertSame(a, flow.getLexicalScope(use).get("a"));
    }
}
