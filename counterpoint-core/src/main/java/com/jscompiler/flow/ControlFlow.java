package com.jscompiler.flow;

import com.jscompiler.ast.ArrowFunctionExpression;
import com.jscompiler.ast.BlockStatement;
import com.jscompiler.ast.CatchClause;
import com.jscompiler.ast.DoWhileStatement;
import com.jscompiler.ast.Expression;
import com.jscompiler.ast.ForInStatement;
import com.jscompiler.ast.ForOfStatement;
import com.jscompiler.ast.FunctionDeclaration;
import com.jscompiler.ast.IfStatement;
import com.jscompiler.ast.Node;
import com.jscompiler.ast.NodeId;
import com.jscompiler.ast.Parameter;
import com.jscompiler.ast.ReturnStatement;
import com.jscompiler.ast.Statement;
import com.jscompiler.ast.SyntaxTree;
import com.jscompiler.ast.ThrowStatement;
import com.jscompiler.ast.TryStatement;
import com.jscompiler.ast.VariableDeclaration;
import com.jscompiler.ast.WhileStatement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Answers the execution-order questions a code generator asks about a node: what runs
 * when it is entered ({@link #step}), what runs once its scope is done ({@link #exit}),
 * and where an error raised inside it is handled ({@link #throwTarget}).
 *
 * <p>Results are derived purely from the tree's structure. {@code step} and
 * {@code exit} are memoized per instance, so one {@code ControlFlow} should live for
 * one compilation pass over one tree.</p>
 */
public final class ControlFlow {

    private final SyntaxTree tree;
    private final Map<NodeId, Optional<Statement>> steps = new HashMap<>();
    private final Map<NodeId, Optional<Statement>> exits = new HashMap<>();

    public ControlFlow(SyntaxTree tree) {
        this.tree = tree;
    }

    public SyntaxTree tree() {
        return tree;
    }

    // ========================================================================
    // step / exit
    // ========================================================================

    /**
     * @return the statement that executes upon entering {@code node}, or empty when
     *         entering it finishes the function
     */
    public Optional<Statement> step(Node node) {
        NodeId id = tree.idOf(node);
        Optional<Statement> cached = steps.get(id);
        if (cached == null) {
            cached = computeStep(node);
            steps.put(id, cached);
        }
        return cached;
    }

    private Optional<Statement> computeStep(Node node) {
        if (node instanceof TryStatement tryStmt) {
            return step(tryStmt.block());
        } else if (node instanceof BlockStatement block) {
            return block.isEmpty() ? exit(block) : step(block.firstStatement());
        } else if (node instanceof CatchClause clause) {
            return clause.param() != null ? step(clause.param()) : step(clause.body());
        } else if (node instanceof VariableDeclaration decl && decl.init() == null) {
            Optional<Statement> next = tree.next(decl);
            return next.isPresent() ? step(next.get()) : exit(decl);
        } else if (node instanceof DoWhileStatement loop) {
            return step(loop.body());
        } else if (node instanceof FunctionDeclaration fn) {
            return step(fn.body());
        } else if (node instanceof Statement stmt) {
            return Optional.of(stmt);
        }
        return exit(node);
    }

    /**
     * @return the statement that runs after the scope of {@code node} completes, or
     *         empty when nothing follows
     */
    public Optional<Statement> exit(Node node) {
        NodeId id = tree.idOf(node);
        Optional<Statement> cached = exits.get(id);
        if (cached == null) {
            cached = computeExit(node);
            exits.put(id, cached);
        }
        return cached;
    }

    private Optional<Statement> computeExit(Node node) {
        if (node instanceof Statement) {
            Optional<Statement> next = tree.next(node);
            if (next.isPresent()) {
                return step(next.get());
            }
        }
        Optional<Node> parent = tree.parent(node);
        if (parent.isEmpty()) {
            return Optional.empty();
        }
        Node scope = parent.get();
        if (scope instanceof WhileStatement || scope instanceof DoWhileStatement) {
            // loop bodies re-enter the loop test
            return Optional.of((Statement) scope);
        } else if (scope instanceof TryStatement tryStmt) {
            if (tryStmt.block() == node || tryStmt.handler() == node) {
                return tryStmt.finalizer() != null ? step(tryStmt.finalizer()) : exit(tryStmt);
            } else if (tryStmt.finalizer() == node) {
                Optional<Statement> next = tree.next(tryStmt);
                return next.isPresent() ? step(next.get()) : exit(tryStmt);
            }
        } else if (scope instanceof CatchClause) {
            TryStatement tryStmt = SyntaxTree.as(tree.parent(scope).orElseThrow(), TryStatement.class);
            return tryStmt.finalizer() != null ? step(tryStmt.finalizer()) : exit(tryStmt);
        } else if (scope instanceof Statement) {
            Optional<Statement> next = tree.next(scope);
            if (next.isPresent()) {
                return step(next.get());
            }
        } else if (scope instanceof Expression) {
            Optional<Node> owner = tree.parent(scope);
            return owner.isPresent() ? step(owner.get()) : Optional.empty();
        }
        return exit(scope);
    }

    // ========================================================================
    // Error routing
    // ========================================================================

    /**
     * Finds the catch clause an error raised at {@code node} is routed to, ignoring
     * finally interception. A finally block never catches errors of its own try.
     */
    public Optional<CatchClause> findCatchClause(Node node) {
        if (tree.isFinallyBlock(node)) {
            return findCatchClause(tree.parent(node).orElseThrow());
        }
        Optional<Node> parent = tree.parent(node);
        if (parent.isEmpty()) {
            return Optional.empty();
        }
        Node scope = parent.get();
        if (scope instanceof TryStatement tryStmt) {
            if (tryStmt.handler() != null) {
                return Optional.of(tryStmt.handler());
            }
            return findCatchClause(tryStmt);
        } else if (scope instanceof CatchClause) {
            // skip the try statement owning this handler
            return findCatchClause(tree.parent(scope).orElseThrow());
        } else if (tree.isFinallyBlock(scope)) {
            return findCatchClause(tree.parent(scope).orElseThrow());
        }
        return findCatchClause(scope);
    }

    /**
     * @return the catch clause or finally block that handles an error raised at
     *         {@code node}; empty when the error is unhandled and terminates execution
     */
    public Optional<Statement> throwTarget(Node node) {
        Optional<CatchClause> catchClause = findCatchClause(node);
        Optional<CatchClause> surroundingCatch = tree.findParent(node, CatchClause.class);

        if (catchClause.isPresent()) {
            if (surroundingCatch.isPresent()) {
                TryStatement surroundingTry = owningTry(surroundingCatch.get());
                TryStatement handlerTry = owningTry(catchClause.get());
                // raised inside a nested catch whose finally runs before the outer handler
                if (surroundingTry.finalizer() != null
                    && tree.contains(handlerTry.block(), surroundingCatch.get())) {
                    return Optional.of(surroundingTry.finalizer());
                }
            }
        } else if (surroundingCatch.isPresent()) {
            TryStatement surroundingTry = owningTry(surroundingCatch.get());
            if (surroundingTry.finalizer() != null) {
                return Optional.of(surroundingTry.finalizer());
            }
        }
        return catchClause.map(Statement.class::cast);
    }

    private TryStatement owningTry(CatchClause clause) {
        return SyntaxTree.as(tree.parent(clause).orElseThrow(), TryStatement.class);
    }

    // ========================================================================
    // Terminality
    // ========================================================================

    /**
     * @return true if every path through {@code node} ends in a return or throw
     */
    public boolean isTerminal(Node node) {
        if (node instanceof ReturnStatement || node instanceof ThrowStatement) {
            return true;
        } else if (node instanceof TryStatement tryStmt) {
            boolean bodiesTerminal = isTerminal(tryStmt.block())
                && (tryStmt.handler() == null || isTerminal(tryStmt.handler().body()));
            if (tryStmt.finalizer() != null) {
                return isTerminal(tryStmt.finalizer()) || bodiesTerminal;
            }
            return bodiesTerminal;
        } else if (node instanceof BlockStatement block) {
            return !block.isEmpty() && isTerminal(block.lastStatement());
        } else if (node instanceof IfStatement ifStmt) {
            return isTerminal(ifStmt.consequent())
                && ifStmt.alternate() != null
                && isTerminal(ifStmt.alternate());
        }
        return false;
    }

    // ========================================================================
    // Lexical scope
    // ========================================================================

    /**
     * Collects the bindings visible at {@code node}: preceding siblings first, then
     * enclosing scopes, with nearer bindings overriding same-named outer ones.
     *
     * @return name to binding node ({@link VariableDeclaration} or {@link Parameter})
     */
    public Map<String, Node> getLexicalScope(Node node) {
        List<Node> chain = new ArrayList<>();
        Node current = node;
        while (current != null) {
            chain.add(current);
            Optional<Statement> prev = current instanceof Statement ? tree.prev(current) : Optional.empty();
            current = prev.isPresent() ? prev.get() : tree.parent(current).orElse(null);
        }
        Collections.reverse(chain);

        Map<String, Node> scope = new LinkedHashMap<>();
        for (Node link : chain) {
            bindingsOf(link, scope);
        }
        return scope;
    }

    public List<String> getVisibleNames(Node node) {
        return new ArrayList<>(getLexicalScope(node).keySet());
    }

    private static void bindingsOf(Node node, Map<String, Node> scope) {
        if (node instanceof VariableDeclaration decl) {
            scope.put(decl.name(), decl);
        } else if (node instanceof FunctionDeclaration fn) {
            for (Parameter param : fn.params()) {
                scope.put(param.name(), param);
            }
        } else if (node instanceof ArrowFunctionExpression fn) {
            for (Parameter param : fn.params()) {
                scope.put(param.name(), param);
            }
        } else if (node instanceof ForOfStatement loop) {
            scope.put(loop.left().name(), loop.left());
        } else if (node instanceof ForInStatement loop) {
            scope.put(loop.left().name(), loop.left());
        } else if (node instanceof CatchClause clause && clause.param() != null) {
            scope.put(clause.param().name(), clause.param());
        }
    }
}
