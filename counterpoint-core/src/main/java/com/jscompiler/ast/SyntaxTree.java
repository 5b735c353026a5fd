package com.jscompiler.ast;

import com.jscompiler.CompilationException;
import com.jscompiler.ErrorKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Arena holding the structural relations of an immutable node tree.
 *
 * <p>Every node is registered under a {@link NodeId}; owner, children and the
 * statement sibling chain are kept in side tables indexed by id, so the node records
 * themselves never point back at their parents. Node identity is reference identity:
 * two structurally equal records are two different nodes.</p>
 *
 * <p>Queries are read-only and uncached; callers absorb the traversal cost.</p>
 */
public final class SyntaxTree {

    private static final int NO_PARENT = -1;

    private final List<Node> nodes = new ArrayList<>();
    private final Map<Node, NodeId> ids = new IdentityHashMap<>();
    private final List<Integer> parents = new ArrayList<>();
    private final List<List<NodeId>> children = new ArrayList<>();
    private final Map<NodeId, NodeId> prev = new HashMap<>();
    private final Map<NodeId, NodeId> next = new HashMap<>();
    private final Node root;

    private SyntaxTree(Node root) {
        this.root = root;
        register(root);
    }

    /**
     * Builds the tree for {@code root}: attaches every structural child in
     * construction order and links consecutive statements of each block.
     */
    public static SyntaxTree of(Node root) {
        SyntaxTree tree = new SyntaxTree(root);
        tree.attachChildren(root);
        return tree;
    }

    /**
     * Creates a tree holding only {@code root}, for front ends that attach nodes one
     * at a time with {@link #setParent(Node, Node)} and {@link #link(Statement, Statement)}.
     */
    public static SyntaxTree rooted(Node root) {
        return new SyntaxTree(root);
    }

    public Node root() {
        return root;
    }

    public int size() {
        return nodes.size();
    }

    // ========================================================================
    // Construction
    // ========================================================================

    /**
     * Attaches {@code child} to {@code parent}, appending it to the parent's children.
     *
     * @throws IllegalStateException if the child already has an owner, or the parent
     *                               is not part of this tree
     */
    public void setParent(Node child, Node parent) {
        NodeId parentId = ids.get(parent);
        if (parentId == null) {
            throw new IllegalStateException("parent " + parent.type() + " is not attached to this tree");
        }
        NodeId childId = ids.get(child);
        if (childId == null) {
            childId = register(child);
        } else if (parents.get(childId.index()) != NO_PARENT || child == root) {
            throw new IllegalStateException(child.type() + " " + childId + " already has a parent");
        }
        parents.set(childId.index(), parentId.index());
        children.get(parentId.index()).add(childId);
    }

    /**
     * Records that {@code after} runs immediately after {@code before} within the same
     * statement sequence.
     */
    public void link(Statement before, Statement after) {
        NodeId b = require(before);
        NodeId a = require(after);
        next.put(b, a);
        prev.put(a, b);
    }

    private NodeId register(Node node) {
        NodeId id = new NodeId(nodes.size());
        nodes.add(node);
        ids.put(node, id);
        parents.add(NO_PARENT);
        children.add(new ArrayList<>());
        return id;
    }

    private void attachChildren(Node node) {
        for (Node child : structuralChildren(node)) {
            setParent(child, node);
            attachChildren(child);
        }
        if (node instanceof BlockStatement block) {
            linkSequence(block.body());
        } else if (node instanceof CatchClause clause && clause.param() != null) {
            // entering the catch flows from the bound error into the handler block
            link(clause.param(), clause.body());
        }
    }

    private void linkSequence(List<Statement> statements) {
        for (int i = 1; i < statements.size(); i++) {
            link(statements.get(i - 1), statements.get(i));
        }
    }

    /**
     * @return the immediate children of {@code node} in construction order
     */
    public static List<Node> structuralChildren(Node node) {
        List<Node> out = new ArrayList<>();
        if (node instanceof FunctionDeclaration fn) {
            out.addAll(fn.params());
            out.add(fn.body());
        } else if (node instanceof ArrowFunctionExpression fn) {
            out.addAll(fn.params());
            out.add(fn.body());
        } else if (node instanceof BlockStatement block) {
            out.addAll(block.body());
        } else if (node instanceof ExpressionStatement stmt) {
            out.add(stmt.expression());
        } else if (node instanceof VariableDeclaration decl) {
            addIfPresent(out, decl.init());
        } else if (node instanceof ReturnStatement ret) {
            addIfPresent(out, ret.argument());
        } else if (node instanceof ThrowStatement thr) {
            out.add(thr.argument());
        } else if (node instanceof IfStatement ifStmt) {
            out.add(ifStmt.test());
            out.add(ifStmt.consequent());
            addIfPresent(out, ifStmt.alternate());
        } else if (node instanceof TryStatement tryStmt) {
            out.add(tryStmt.block());
            addIfPresent(out, tryStmt.handler());
            addIfPresent(out, tryStmt.finalizer());
        } else if (node instanceof CatchClause clause) {
            addIfPresent(out, clause.param());
            out.add(clause.body());
        } else if (node instanceof WhileStatement loop) {
            out.add(loop.test());
            out.add(loop.body());
        } else if (node instanceof DoWhileStatement loop) {
            out.add(loop.body());
            out.add(loop.test());
        } else if (node instanceof ForOfStatement loop) {
            out.add(loop.left());
            out.add(loop.right());
            out.add(loop.body());
        } else if (node instanceof ForInStatement loop) {
            out.add(loop.left());
            out.add(loop.right());
            out.add(loop.body());
        } else if (node instanceof MemberExpression member) {
            out.add(member.object());
            out.add(member.property());
        } else if (node instanceof CallExpression call) {
            out.add(call.callee());
            out.addAll(call.arguments());
        } else if (node instanceof NewExpression call) {
            out.add(call.callee());
            out.addAll(call.arguments());
        } else if (node instanceof UnaryExpression unary) {
            out.add(unary.argument());
        } else if (node instanceof BinaryExpression binary) {
            out.add(binary.left());
            out.add(binary.right());
        } else if (node instanceof LogicalExpression logical) {
            out.add(logical.left());
            out.add(logical.right());
        } else if (node instanceof ConditionalExpression cond) {
            out.add(cond.test());
            out.add(cond.consequent());
            out.add(cond.alternate());
        } else if (node instanceof AssignmentExpression assign) {
            out.add(assign.left());
            out.add(assign.right());
        } else if (node instanceof ArrayExpression array) {
            out.addAll(array.elements());
        } else if (node instanceof ObjectExpression object) {
            out.addAll(object.properties());
        } else if (node instanceof Property prop) {
            out.add(prop.key());
            out.add(prop.value());
        } else if (node instanceof SpreadElement spread) {
            out.add(spread.argument());
        } else if (node instanceof TemplateLiteral template) {
            out.addAll(template.parts());
        }
        return out;
    }

    private static void addIfPresent(List<Node> out, Node node) {
        if (node != null) {
            out.add(node);
        }
    }

    // ========================================================================
    // Identity
    // ========================================================================

    public NodeId idOf(Node node) {
        return require(node);
    }

    public Node node(NodeId id) {
        return nodes.get(id.index());
    }

    public boolean isAttached(Node node) {
        return ids.containsKey(node);
    }

    private NodeId require(Node node) {
        NodeId id = ids.get(node);
        if (id == null) {
            throw new IllegalArgumentException(node.type() + " is not part of this tree");
        }
        return id;
    }

    // ========================================================================
    // Structural queries
    // ========================================================================

    public Optional<Node> parent(Node node) {
        int p = parents.get(require(node).index());
        return p == NO_PARENT ? Optional.empty() : Optional.of(nodes.get(p));
    }

    public List<Node> children(Node node) {
        List<NodeId> childIds = children.get(require(node).index());
        List<Node> out = new ArrayList<>(childIds.size());
        for (NodeId id : childIds) {
            out.add(node(id));
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * @return the statement that precedes {@code stmt} in its sequence
     */
    public Optional<Statement> prev(Node stmt) {
        NodeId id = prev.get(require(stmt));
        return id == null ? Optional.empty() : Optional.of((Statement) node(id));
    }

    /**
     * @return the statement that follows {@code stmt} in its sequence
     */
    public Optional<Statement> next(Node stmt) {
        NodeId id = next.get(require(stmt));
        return id == null ? Optional.empty() : Optional.of((Statement) node(id));
    }

    /**
     * Narrows {@code node} to {@code type}.
     *
     * @throws CompilationException of kind {@link ErrorKind#TYPE_MISMATCH} when the
     *                              node is of another kind
     */
    public static <T extends Node> T as(Node node, Class<T> type) {
        if (!type.isInstance(node)) {
            throw new CompilationException(ErrorKind.TYPE_MISMATCH,
                "expected to be a " + type.getSimpleName() + " but was " + node.type(), node);
        }
        return type.cast(node);
    }

    /**
     * Tests {@code node} against a type guard without raising.
     */
    public static boolean is(Node node, Predicate<? super Node> guard) {
        return node != null && guard.test(node);
    }

    public List<Node> findChildren(Node node, Predicate<? super Node> guard) {
        List<Node> out = new ArrayList<>();
        for (Node child : children(node)) {
            if (guard.test(child)) {
                out.add(child);
            }
        }
        return out;
    }

    public <T extends Node> List<T> findChildren(Node node, Class<T> type) {
        List<T> out = new ArrayList<>();
        for (Node child : children(node)) {
            if (type.isInstance(child)) {
                out.add(type.cast(child));
            }
        }
        return out;
    }

    /**
     * Maps every descendant of {@code node} (pre-order, excluding the node itself) and
     * flattens the results.
     */
    public <T> List<T> collectChildren(Node node, Function<Node, List<T>> mapper) {
        List<T> out = new ArrayList<>();
        for (Node child : children(node)) {
            out.addAll(mapper.apply(child));
            out.addAll(collectChildren(child, mapper));
        }
        return out;
    }

    /**
     * Walks the owners of {@code node}, nearest first.
     */
    public Optional<Node> findParent(Node node, Predicate<? super Node> guard) {
        Optional<Node> scope = parent(node);
        while (scope.isPresent()) {
            if (guard.test(scope.get())) {
                return scope;
            }
            scope = parent(scope.get());
        }
        return Optional.empty();
    }

    public <T extends Node> Optional<T> findParent(Node node, Class<T> type) {
        return findParent(node, type::isInstance).map(type::cast);
    }

    /**
     * @return true if {@code node} is a strict descendant of {@code ancestor}
     */
    public boolean contains(Node ancestor, Node node, Traversal traversal) {
        NodeId target = ids.get(node);
        if (target == null) {
            return false;
        }
        Deque<NodeId> pending = new ArrayDeque<>();
        enqueue(pending, children.get(require(ancestor).index()), traversal);
        while (!pending.isEmpty()) {
            NodeId current = traversal == Traversal.DEPTH_FIRST ? pending.pollLast() : pending.pollFirst();
            if (current.equals(target)) {
                return true;
            }
            enqueue(pending, children.get(current.index()), traversal);
        }
        return false;
    }

    private static void enqueue(Deque<NodeId> pending, List<NodeId> nested, Traversal traversal) {
        if (traversal == Traversal.DEPTH_FIRST) {
            // stack: leftmost child on top
            for (int i = nested.size() - 1; i >= 0; i--) {
                pending.addLast(nested.get(i));
            }
        } else {
            pending.addAll(nested);
        }
    }

    public boolean contains(Node ancestor, Node node) {
        return contains(ancestor, node, Traversal.DEPTH_FIRST);
    }

    /**
     * @return true if {@code node} is the finalizer of its owning try statement
     */
    public boolean isFinallyBlock(Node node) {
        if (!(node instanceof BlockStatement)) {
            return false;
        }
        return parent(node)
            .filter(p -> p instanceof TryStatement t && t.finalizer() == node)
            .isPresent();
    }
}
