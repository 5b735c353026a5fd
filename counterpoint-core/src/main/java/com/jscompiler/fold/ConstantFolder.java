package com.jscompiler.fold;

import com.jscompiler.CompilationException;
import com.jscompiler.ErrorKind;
import com.jscompiler.ast.Expression;
import com.jscompiler.ast.Identifier;
import com.jscompiler.ast.Literal;
import com.jscompiler.ast.MemberExpression;
import com.jscompiler.ast.ReferenceExpression;
import com.jscompiler.ast.UnaryExpression;
import com.jscompiler.service.ExternalReferences;
import com.jscompiler.util.JsNumbers;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import java.util.Map;
import java.util.Optional;

/**
 * Evaluates expressions that are statically known.
 *
 * <pre>
 * "value"  -> Constant("value")
 * undefined -> Constant(UNDEFINED)
 * null     -> Constant(null)
 * -10      -> Constant(-10)
 * call()   -> empty
 * </pre>
 *
 * <p>External references resolve through {@link ExternalReferences} and are kept even
 * when the resolved value is not a primitive, so a property of an opaque handle
 * (e.g. {@code machine.stateMachineArn}) still folds.</p>
 *
 * <p>Identifiers bound to local declarations must already have been substituted by
 * {@link ExpressionFlattener}.</p>
 */
public final class ConstantFolder {

    private final ExternalReferences references;

    public ConstantFolder(ExternalReferences references) {
        this.references = references;
    }

    public Optional<Constant> evalToConstant(Expression expr) {
        if (expr instanceof Literal literal) {
            Object value = literal.value();
            return Optional.of(new Constant(value instanceof Number n ? JsNumbers.normalize(n) : value));
        } else if (expr instanceof Identifier id && "undefined".equals(id.name())) {
            return Optional.of(Constant.UNDEFINED);
        } else if (expr instanceof UnaryExpression unary && "-".equals(unary.operator())) {
            Optional<Constant> operand = evalToConstant(unary.argument());
            if (operand.isEmpty()) {
                return Optional.empty();
            }
            if (!(operand.get().value() instanceof Number n)) {
                throw new CompilationException(ErrorKind.TYPE_MISMATCH,
                    "expected a number to negate but found " + operand.get().asString(), unary);
            }
            return Optional.of(new Constant(JsNumbers.negate(n)));
        } else if (expr instanceof MemberExpression member && !member.computed()) {
            return evalToConstant(member.object())
                .flatMap(owner -> propertyOf(owner.value(), member.propertyName()));
        } else if (expr instanceof ReferenceExpression ref) {
            Object value = references.resolve(ref);
            return Optional.of(new Constant(value instanceof Number n ? JsNumbers.normalize(n) : value));
        }
        return Optional.empty();
    }

    private static Optional<Constant> propertyOf(Object owner, String name) {
        if (owner instanceof Map<?, ?> map) {
            return map.containsKey(name) ? Optional.of(new Constant(map.get(name))) : Optional.empty();
        } else if (owner != null && owner.getClass().isRecord()) {
            for (RecordComponent component : owner.getClass().getRecordComponents()) {
                if (component.getName().equals(name)) {
                    return Optional.of(new Constant(read(owner, component)));
                }
            }
        }
        return Optional.empty();
    }

    private static Object read(Object owner, RecordComponent component) {
        try {
            return component.getAccessor().invoke(owner);
        } catch (IllegalAccessException | InvocationTargetException e) {
            throw new IllegalStateException("cannot read " + component.getName() + " of " + owner, e);
        }
    }
}
