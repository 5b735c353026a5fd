package com.jscompiler.service;

import com.jscompiler.CompilationException;
import com.jscompiler.ErrorKind;
import com.jscompiler.ast.ArrowFunctionExpression;
import com.jscompiler.ast.CallExpression;
import com.jscompiler.ast.Expression;
import com.jscompiler.ast.MemberExpression;
import com.jscompiler.ast.Node;
import com.jscompiler.ast.ReferenceExpression;
import com.jscompiler.ast.SyntaxTree;

import java.util.Optional;

/**
 * Recognizes calls into {@link Service}s.
 *
 * <p>A service call is a call whose callee is a reference ({@code fn(x)}) or a
 * property of a reference ({@code table.getItem(x)}). Anything chained after it,
 * e.g. {@code fn(x).prop} or {@code table.query(q).Items.size()}, is applied to
 * the call's result.</p>
 */
public final class ServiceCalls {

    private final ExternalReferences references;

    public ServiceCalls(ExternalReferences references) {
        this.references = references;
    }

    public ExternalReferences references() {
        return references;
    }

    /**
     * @return the service invoked by {@code call} itself, if any
     */
    public Optional<Service> resolveCallee(CallExpression call) {
        Expression callee = call.callee();
        if (callee instanceof ReferenceExpression ref) {
            return asService(references.resolve(ref));
        } else if (callee instanceof MemberExpression member && member.object() instanceof ReferenceExpression ref) {
            return asService(references.resolve(ref));
        }
        return Optional.empty();
    }

    private static Optional<Service> asService(Object value) {
        return value instanceof Service service ? Optional.of(service) : Optional.empty();
    }

    /**
     * @return the method named by a {@code service.method(...)} call, or null for a
     *         direct invocation
     */
    public static String methodOf(CallExpression call) {
        return call.callee() instanceof MemberExpression member ? member.propertyName() : null;
    }

    /**
     * Finds the first service call inside {@code node}, without descending into
     * inline functions.
     */
    public Optional<CallExpression> findServiceCall(Node node) {
        if (node instanceof ArrowFunctionExpression) {
            return Optional.empty();
        }
        if (node instanceof CallExpression call && resolveCallee(call).isPresent()) {
            return Optional.of(call);
        }
        for (Node child : SyntaxTree.structuralChildren(node)) {
            Optional<CallExpression> found = findServiceCall(child);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    /**
     * @return the service a statement invokes, if it invokes one
     */
    public Optional<Service> findService(Node stmt) {
        return findServiceCall(stmt).flatMap(this::resolveCallee);
    }

    /**
     * Unwinds property accesses and calls applied to a service call's result down to
     * the service call itself.
     *
     * @throws CompilationException if {@code expr} is not rooted at a service call
     */
    public CallExpression unwindToServiceCall(Expression expr) {
        if (expr instanceof CallExpression call && resolveCallee(call).isPresent()) {
            return call;
        } else if (expr instanceof MemberExpression member) {
            return unwindToServiceCall(member.object());
        } else if (expr instanceof CallExpression call) {
            return unwindToServiceCall(call.callee());
        }
        throw new CompilationException(ErrorKind.UNSUPPORTED_CALL_POSITION,
            "a service call must be invoked directly, or have its result accessed", expr);
    }

    /**
     * @return a name for the callee usable as a function or state name
     */
    public static String nameOf(CallExpression call, Service service) {
        String method = methodOf(call);
        return method == null ? service.name() : service.name() + "_" + method;
    }
}
