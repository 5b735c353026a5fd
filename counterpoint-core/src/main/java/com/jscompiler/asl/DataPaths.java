package com.jscompiler.asl;

import com.jscompiler.CompilationException;
import com.jscompiler.ErrorKind;
import com.jscompiler.ast.ArrayExpression;
import com.jscompiler.ast.BinaryExpression;
import com.jscompiler.ast.CallExpression;
import com.jscompiler.ast.Expression;
import com.jscompiler.ast.Identifier;
import com.jscompiler.ast.Literal;
import com.jscompiler.ast.LogicalExpression;
import com.jscompiler.ast.MemberExpression;
import com.jscompiler.ast.ObjectExpression;
import com.jscompiler.ast.Property;
import com.jscompiler.ast.SpreadElement;
import com.jscompiler.ast.TemplateLiteral;
import com.jscompiler.ast.UnaryExpression;
import com.jscompiler.fold.Constant;
import com.jscompiler.fold.ConstantFolder;
import com.jscompiler.fold.Undefined;
import com.jscompiler.util.JsNumbers;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Translates expressions into the orchestrator's data language: JSON paths into the
 * state ({@code x.y} is {@code $.x.y}), {@code .$}-suffixed parameter assignments,
 * intrinsic functions and Choice conditions.
 */
final class DataPaths {

    private final ConstantFolder folder;

    DataPaths(ConstantFolder folder) {
        this.folder = folder;
    }

    // ========================================================================
    // Paths and constants
    // ========================================================================

    boolean isPath(Expression expr) {
        if (expr instanceof Identifier id) {
            return !"undefined".equals(id.name());
        } else if (expr instanceof MemberExpression member) {
            return (!member.computed() || folder.evalToConstant(member.property()).isPresent())
                && isPath(member.object());
        }
        return false;
    }

    String toJsonPath(Expression expr) {
        if (expr instanceof Identifier id && !"undefined".equals(id.name())) {
            return "$." + id.name();
        } else if (expr instanceof MemberExpression member) {
            String owner = toJsonPath(member.object());
            if (!member.computed()) {
                return owner + "." + member.propertyName();
            }
            Object key = folder.evalToConstant(member.property()).map(Constant::value).orElse(null);
            if (key instanceof Number n) {
                return owner + "[" + JsNumbers.format(n) + "]";
            } else if (key instanceof String s) {
                return owner + "['" + s.replace("'", "\\'") + "']";
            }
        }
        throw new CompilationException(ErrorKind.INVALID_ARGUMENT,
            expr.type() + " cannot be referenced as a data path", expr);
    }

    /**
     * @return the JSON value of an expression known at compile time
     */
    Optional<Object> constantValue(Expression expr) {
        if (expr instanceof ObjectExpression object) {
            Map<String, Object> value = new LinkedHashMap<>();
            for (Expression member : object.properties()) {
                if (!(member instanceof Property property) || property.staticKey() == null) {
                    return Optional.empty();
                }
                Optional<Object> inner = constantValue(property.value());
                if (inner.isEmpty()) {
                    return Optional.empty();
                }
                value.put(property.staticKey(), inner.get());
            }
            return Optional.of(value);
        } else if (expr instanceof ArrayExpression array) {
            List<Object> value = new ArrayList<>();
            for (Expression element : array.elements()) {
                Optional<Object> inner = constantValue(element);
                if (inner.isEmpty()) {
                    return Optional.empty();
                }
                value.add(inner.get());
            }
            return Optional.of(value);
        }
        return folder.evalToConstant(expr)
            .filter(Constant::isPrimitive)
            .map(c -> toJson(c.value()));
    }

    private static Object toJson(Object value) {
        if (value == null || value == Undefined.VALUE) {
            return JsonNull.INSTANCE;
        } else if (value instanceof Number n) {
            return JsNumbers.normalize(n);
        }
        return value;
    }

    // ========================================================================
    // Parameters
    // ========================================================================

    /**
     * Adds {@code key} to a parameters object: constants as-is, everything else as a
     * {@code key.$} path or intrinsic.
     */
    void assign(Map<String, Object> target, String key, Expression expr) {
        Optional<Object> constant = constantValue(expr);
        if (constant.isPresent()) {
            target.put(key, constant.get());
        } else if (isPath(expr)) {
            target.put(key + ".$", toJsonPath(expr));
        } else if (expr instanceof ObjectExpression object) {
            target.put(key, parametersOf(object));
        } else {
            target.put(key + ".$", intrinsic(expr));
        }
    }

    Map<String, Object> parametersOf(ObjectExpression object) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        for (Expression member : object.properties()) {
            if (member instanceof SpreadElement spread) {
                throw new CompilationException(ErrorKind.UNSUPPORTED_SPREAD,
                    "objects passed to a state cannot spread other objects", spread);
            }
            Property property = (Property) member;
            if (property.staticKey() == null) {
                throw new CompilationException(ErrorKind.INVALID_ARGUMENT,
                    "objects passed to a state must have constant keys", property);
            }
            assign(parameters, property.staticKey(), property.value());
        }
        return parameters;
    }

    private String intrinsic(Expression expr) {
        if (expr instanceof TemplateLiteral template) {
            StringBuilder format = new StringBuilder();
            List<String> args = new ArrayList<>();
            for (Expression part : template.parts()) {
                Optional<Constant> constant = folder.evalToConstant(part);
                if (constant.isPresent() && constant.get().isPrimitive()) {
                    format.append(escapeFormat(constant.get().asString()));
                } else {
                    format.append("{}");
                    args.add(toJsonPath(part));
                }
            }
            StringBuilder call = new StringBuilder("States.Format('").append(format).append('\'');
            for (String arg : args) {
                call.append(", ").append(arg);
            }
            return call.append(')').toString();
        } else if (expr instanceof ArrayExpression array) {
            List<String> args = new ArrayList<>();
            for (Expression element : array.elements()) {
                args.add(intrinsicArgument(element));
            }
            return "States.Array(" + String.join(", ", args) + ")";
        } else if (expr instanceof CallExpression call && call.callee() instanceof MemberExpression callee
            && callee.object() instanceof Identifier owner && "JSON".equals(owner.name())
            && call.argument(0) != null) {
            if ("stringify".equals(callee.propertyName())) {
                return "States.JsonToString(" + toJsonPath(call.argument(0)) + ")";
            } else if ("parse".equals(callee.propertyName())) {
                return "States.StringToJson(" + toJsonPath(call.argument(0)) + ")";
            }
        }
        throw new CompilationException(ErrorKind.INVALID_ARGUMENT,
            expr.type() + " cannot be passed to a state", expr);
    }

    private String intrinsicArgument(Expression expr) {
        if (isPath(expr)) {
            return toJsonPath(expr);
        }
        Object value = folder.evalToConstant(expr).filter(Constant::isPrimitive).map(Constant::value)
            .orElseThrow(() -> new CompilationException(ErrorKind.INVALID_ARGUMENT,
                "intrinsic arguments must be constants or paths", expr));
        if (value instanceof String s) {
            return "'" + escapeFormat(s) + "'";
        }
        return new Constant(value == Undefined.VALUE ? null : value).asString();
    }

    private static String escapeFormat(String text) {
        StringBuilder out = new StringBuilder();
        for (char c : text.toCharArray()) {
            if (c == '\'' || c == '{' || c == '}' || c == '\\') {
                out.append('\\');
            }
            out.append(c);
        }
        return out.toString();
    }

    // ========================================================================
    // Conditions
    // ========================================================================

    Map<String, Object> condition(Expression test) {
        if (test instanceof Literal literal && literal.value() instanceof Boolean b) {
            Map<String, Object> always = rule("$", "IsPresent", true);
            return b ? always : not(always);
        } else if (test instanceof UnaryExpression unary && "!".equals(unary.operator())) {
            return not(condition(unary.argument()));
        } else if (test instanceof LogicalExpression logical && !"??".equals(logical.operator())) {
            String combinator = "&&".equals(logical.operator()) ? "And" : "Or";
            List<Object> operands = new ArrayList<>();
            for (Expression side : List.of(logical.left(), logical.right())) {
                Map<String, Object> inner = condition(side);
                if (inner.size() == 1 && inner.get(combinator) instanceof List<?> nested) {
                    operands.addAll(nested);
                } else {
                    operands.add(inner);
                }
            }
            Map<String, Object> combined = new LinkedHashMap<>();
            combined.put(combinator, operands);
            return combined;
        } else if (test instanceof BinaryExpression binary) {
            return comparison(binary);
        } else if (isPath(test)) {
            String path = toJsonPath(test);
            Map<String, Object> truthy = new LinkedHashMap<>();
            truthy.put("And", List.of(
                rule(path, "IsPresent", true),
                rule(path, "IsNull", false),
                not(rule(path, "BooleanEquals", false)),
                not(rule(path, "StringEquals", "")),
                not(rule(path, "NumericEquals", 0))));
            return truthy;
        }
        throw new CompilationException(ErrorKind.INVALID_ARGUMENT,
            test.type() + " cannot be used as a condition", test);
    }

    private Map<String, Object> comparison(BinaryExpression binary) {
        Expression pathSide = binary.left();
        Expression valueSide = binary.right();
        String operator = binary.operator();
        if (!isPath(pathSide) && isPath(valueSide)) {
            pathSide = binary.right();
            valueSide = binary.left();
            operator = mirror(operator);
        }
        Optional<Constant> constant = folder.evalToConstant(valueSide).filter(Constant::isPrimitive);
        if (!isPath(pathSide) || constant.isEmpty()) {
            throw new CompilationException(ErrorKind.INVALID_ARGUMENT,
                "a condition must compare a variable with a constant", binary);
        }
        String path = toJsonPath(pathSide);
        Object value = constant.get().value();
        return switch (operator) {
            case "===", "==" -> equality(path, value, binary);
            case "!==", "!=" -> not(equality(path, value, binary));
            case "<" -> ordering(path, value, "LessThan", binary);
            case "<=" -> ordering(path, value, "LessThanEquals", binary);
            case ">" -> ordering(path, value, "GreaterThan", binary);
            case ">=" -> ordering(path, value, "GreaterThanEquals", binary);
            default -> throw new CompilationException(ErrorKind.INVALID_ARGUMENT,
                "operator " + operator + " cannot be used in a condition", binary);
        };
    }

    private static String mirror(String operator) {
        return switch (operator) {
            case "<" -> ">";
            case "<=" -> ">=";
            case ">" -> "<";
            case ">=" -> "<=";
            default -> operator;
        };
    }

    private static Map<String, Object> equality(String path, Object value, Expression at) {
        if (value == null) {
            return rule(path, "IsNull", true);
        } else if (value == Undefined.VALUE) {
            return rule(path, "IsPresent", false);
        } else if (value instanceof String) {
            return rule(path, "StringEquals", value);
        } else if (value instanceof Number n) {
            return rule(path, "NumericEquals", JsNumbers.normalize(n));
        } else if (value instanceof Boolean) {
            return rule(path, "BooleanEquals", value);
        }
        throw new CompilationException(ErrorKind.INVALID_ARGUMENT, "cannot compare with " + value, at);
    }

    private static Map<String, Object> ordering(String path, Object value, String comparison, Expression at) {
        if (value instanceof String) {
            return rule(path, "String" + comparison, value);
        } else if (value instanceof Number n) {
            return rule(path, "Numeric" + comparison, JsNumbers.normalize(n));
        }
        throw new CompilationException(ErrorKind.INVALID_ARGUMENT,
            "only strings and numbers can be ordered", at);
    }

    private static Map<String, Object> rule(String path, String comparison, Object value) {
        Map<String, Object> rule = new LinkedHashMap<>();
        rule.put("Variable", path);
        rule.put(comparison, value);
        return rule;
    }

    private static Map<String, Object> not(Map<String, Object> inner) {
        Map<String, Object> negated = new LinkedHashMap<>();
        negated.put("Not", inner);
        return negated;
    }
}
