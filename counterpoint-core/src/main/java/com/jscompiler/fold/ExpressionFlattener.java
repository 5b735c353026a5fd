package com.jscompiler.fold;

import com.jscompiler.CompilationException;
import com.jscompiler.ErrorKind;
import com.jscompiler.ast.ArrayExpression;
import com.jscompiler.ast.BinaryExpression;
import com.jscompiler.ast.Expression;
import com.jscompiler.ast.Identifier;
import com.jscompiler.ast.Literal;
import com.jscompiler.ast.LogicalExpression;
import com.jscompiler.ast.MemberExpression;
import com.jscompiler.ast.ObjectExpression;
import com.jscompiler.ast.Property;
import com.jscompiler.ast.ReturnStatement;
import com.jscompiler.ast.SpreadElement;
import com.jscompiler.ast.Statement;
import com.jscompiler.ast.SyntaxTree;
import com.jscompiler.ast.TemplateLiteral;
import com.jscompiler.ast.UnaryExpression;
import com.jscompiler.ast.VariableDeclaration;
import com.jscompiler.util.JsNumbers;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Removes local references from an expression by substituting every identifier bound
 * in scope with the expression it was bound to, then resolving accesses into known
 * object and array literals.
 *
 * <pre>
 * const obj = { val: "hi" };
 * return obj.val + " there";   // becomes "hi" + " there"
 * </pre>
 *
 * <p>The input is never modified: every rewritten node is a new record. Templates
 * whose parts are all constants collapse into a single string literal.</p>
 */
public final class ExpressionFlattener {

    private final ConstantFolder folder;

    public ExpressionFlattener(ConstantFolder folder) {
        this.folder = folder;
    }

    public ConstantFolder folder() {
        return folder;
    }

    /**
     * @param scope local bindings; a name mapped to null is declared but not initialized
     */
    public Expression flattenExpression(Expression expr, Map<String, Expression> scope) {
        if (expr instanceof UnaryExpression unary) {
            return new UnaryExpression(unary.start(), unary.end(), unary.operator(),
                flattenExpression(unary.argument(), scope));
        } else if (expr instanceof Identifier id) {
            if (scope.containsKey(id.name())) {
                Expression bound = scope.get(id.name());
                if (bound == null) {
                    throw new CompilationException(ErrorKind.INVALID_REFERENCE,
                        "reference " + id.name() + " is not yet instantiated", id);
                }
                return bound;
            }
            return id;
        } else if (expr instanceof MemberExpression member) {
            return flattenAccess(member, scope);
        } else if (expr instanceof ArrayExpression array) {
            return flattenArray(array, scope);
        } else if (expr instanceof BinaryExpression binary) {
            return new BinaryExpression(binary.start(), binary.end(), binary.operator(),
                flattenExpression(binary.left(), scope), flattenExpression(binary.right(), scope));
        } else if (expr instanceof LogicalExpression logical) {
            return new LogicalExpression(logical.start(), logical.end(), logical.operator(),
                flattenExpression(logical.left(), scope), flattenExpression(logical.right(), scope));
        } else if (expr instanceof ObjectExpression object) {
            return flattenObject(object, scope);
        } else if (expr instanceof TemplateLiteral template) {
            return flattenTemplate(template, scope);
        }
        return expr;
    }

    private Expression flattenAccess(MemberExpression member, Map<String, Expression> scope) {
        Object key = member.computed()
            ? propertyKey(MemberExpression.element(member.object(), flattenExpression(member.property(), scope)))
            : getPropertyAccessKey(member);
        Expression owner = flattenExpression(member.object(), scope);

        if (owner instanceof ObjectExpression object) {
            if (!(key instanceof String name)) {
                throw new CompilationException(ErrorKind.INVALID_ACCESS, "object access must be a string", member);
            }
            Property property = object.getProperty(name);
            if (property == null) {
                String keys = object.properties().stream()
                    .filter(Property.class::isInstance)
                    .map(p -> ((Property) p).staticKey())
                    .filter(k -> k != null)
                    .collect(Collectors.joining(","));
                throw new CompilationException(ErrorKind.PROPERTY_NOT_FOUND,
                    "cannot find property " + name + " in object with constant keys: " + keys
                        + " of " + object.properties().size() + " keys", member);
            }
            return property.value();
        } else if (owner instanceof ArrayExpression array) {
            if (!(key instanceof Integer index)) {
                throw new CompilationException(ErrorKind.INVALID_ACCESS, "array access must be a number", member);
            }
            return index >= 0 && index < array.elements().size()
                ? array.elements().get(index)
                : new Identifier("undefined");
        }
        return key instanceof String name
            ? new MemberExpression(member.start(), member.end(), owner, new Identifier(name), false)
            : new MemberExpression(member.start(), member.end(), owner, new Literal(key), true);
    }

    private Expression flattenArray(ArrayExpression array, Map<String, Expression> scope) {
        List<Expression> items = new ArrayList<>();
        for (Expression element : array.elements()) {
            if (element instanceof SpreadElement spread) {
                Expression target = flattenExpression(spread.argument(), scope);
                if (!(target instanceof ArrayExpression spreadArray)) {
                    throw new CompilationException(ErrorKind.UNSUPPORTED_SPREAD,
                        "only constant arrays can be spread into an array", spread);
                }
                items.addAll(spreadArray.elements());
            } else {
                items.add(flattenExpression(element, scope));
            }
        }
        return new ArrayExpression(array.start(), array.end(), items);
    }

    private Expression flattenObject(ObjectExpression object, Map<String, Expression> scope) {
        List<Expression> properties = new ArrayList<>();
        for (Expression member : object.properties()) {
            if (member instanceof Property property) {
                Expression key = property.key();
                if (property.computed() || !(key instanceof Identifier)) {
                    Literal literal = SyntaxTree.as(flattenExpression(key, scope), Literal.class);
                    if (!literal.isString()) {
                        throw new CompilationException(ErrorKind.TYPE_MISMATCH,
                            "computed keys must fold to a string", property);
                    }
                    key = literal;
                }
                properties.add(new Property(property.start(), property.end(), key,
                    flattenExpression(property.value(), scope), false));
            } else if (member instanceof SpreadElement spread) {
                Expression target = flattenExpression(spread.argument(), scope);
                if (!(target instanceof ObjectExpression spreadObject)) {
                    throw new CompilationException(ErrorKind.UNSUPPORTED_SPREAD,
                        "only constant objects can be spread into an object", spread);
                }
                for (Expression spreadMember : spreadObject.properties()) {
                    if (spreadMember instanceof Property) {
                        properties.add(spreadMember);
                    }
                }
            }
        }
        return new ObjectExpression(object.start(), object.end(), properties);
    }

    private Expression flattenTemplate(TemplateLiteral template, Map<String, Expression> scope) {
        List<Expression> parts = new ArrayList<>();
        StringBuilder folded = new StringBuilder();
        boolean allConstant = true;
        for (Expression part : template.parts()) {
            Expression flattened = flattenExpression(part, scope);
            parts.add(flattened);
            if (allConstant) {
                Optional<Constant> constant = folder.evalToConstant(flattened);
                if (constant.isPresent()) {
                    folded.append(constant.get().asString());
                } else {
                    allConstant = false;
                }
            }
        }
        return allConstant
            ? new Literal(template.start(), template.end(), folded.toString())
            : new TemplateLiteral(template.start(), template.end(), parts);
    }

    /**
     * @return the key of a property access ({@code a.b} gives "b") or of an element
     *         access with a constant key ({@code a[0]} gives 0)
     */
    public Object getPropertyAccessKey(MemberExpression member) {
        return member.computed() ? propertyKey(member) : member.propertyName();
    }

    private Object propertyKey(MemberExpression member) {
        Object key = folder.evalToConstant(member.property()).map(Constant::value).orElse(null);
        if (key instanceof Number n) {
            return JsNumbers.normalize(n);
        } else if (key instanceof String) {
            return key;
        }
        throw new CompilationException(ErrorKind.INVALID_ACCESS,
            "property key must be a number or a string, found "
                + (key == null ? "a non-constant" : key.getClass().getSimpleName()), member);
    }

    /**
     * Recovers the property keys accessed off a root identifier.
     *
     * @return empty when the chain is not rooted at a plain identifier
     */
    public Optional<ReferencePath> getReferencePath(Expression expr) {
        if (expr instanceof Identifier id) {
            return Optional.of(new ReferencePath(id.name(), List.of()));
        } else if (expr instanceof MemberExpression member) {
            Object key = getPropertyAccessKey(member);
            return getReferencePath(member.object()).map(parent -> parent.append(key));
        }
        return Optional.empty();
    }

    /**
     * Folds declarations into a scope in order, each initializer flattened against the
     * bindings before it. A later declaration of the same name replaces the earlier.
     */
    public Map<String, Expression> flattenStatementsScope(List<VariableDeclaration> declarations) {
        Map<String, Expression> scope = new LinkedHashMap<>();
        for (VariableDeclaration declaration : declarations) {
            Expression flattened = declaration.init() == null
                ? null
                : flattenExpression(declaration.init(), scope);
            scope.put(declaration.name(), flattened);
        }
        return scope;
    }

    /**
     * Flattens the returned expression of a body made of declarations followed by a
     * return.
     *
     * @throws CompilationException of kind {@link ErrorKind#MISSING_RETURN} when the
     *                              last statement is not a return with a value
     */
    public Expression flattenReturnEvent(List<Statement> statements) {
        if (statements.isEmpty()
            || !(statements.get(statements.size() - 1) instanceof ReturnStatement ret)
            || ret.argument() == null) {
            throw new CompilationException(ErrorKind.MISSING_RETURN, "no return statement found in the transform function");
        }
        List<VariableDeclaration> declarations = new ArrayList<>();
        for (Statement statement : statements.subList(0, statements.size() - 1)) {
            if (statement instanceof VariableDeclaration declaration) {
                declarations.add(declaration);
            }
        }
        return flattenExpression(ret.argument(), flattenStatementsScope(declarations));
    }
}
