package com.jscompiler.asl;

import com.jscompiler.ast.ArrayExpression;
import com.jscompiler.ast.ArrowFunctionExpression;
import com.jscompiler.ast.AssignmentExpression;
import com.jscompiler.ast.BinaryExpression;
import com.jscompiler.ast.BreakStatement;
import com.jscompiler.ast.CallExpression;
import com.jscompiler.ast.ConditionalExpression;
import com.jscompiler.ast.ContinueStatement;
import com.jscompiler.ast.DoWhileStatement;
import com.jscompiler.ast.Expression;
import com.jscompiler.ast.ExpressionStatement;
import com.jscompiler.ast.ForInStatement;
import com.jscompiler.ast.ForOfStatement;
import com.jscompiler.ast.Identifier;
import com.jscompiler.ast.IfStatement;
import com.jscompiler.ast.Literal;
import com.jscompiler.ast.LogicalExpression;
import com.jscompiler.ast.MemberExpression;
import com.jscompiler.ast.NewExpression;
import com.jscompiler.ast.ObjectExpression;
import com.jscompiler.ast.Parameter;
import com.jscompiler.ast.Property;
import com.jscompiler.ast.ReferenceExpression;
import com.jscompiler.ast.ReturnStatement;
import com.jscompiler.ast.SpreadElement;
import com.jscompiler.ast.Statement;
import com.jscompiler.ast.TemplateLiteral;
import com.jscompiler.ast.ThrowStatement;
import com.jscompiler.ast.UnaryExpression;
import com.jscompiler.ast.VariableDeclaration;
import com.jscompiler.ast.WhileStatement;
import com.jscompiler.util.JsNumbers;

import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Names states after the source they were compiled from, e.g. {@code const x = fn(a)}
 * or {@code if(x === 1)}. Names are truncated to the orchestrator's limit and made
 * unique within one machine by appending a counter.
 */
final class StateNames {

    private final int maxLength;
    private final Set<String> used = new HashSet<>();
    private final Map<Statement, String> assigned = new IdentityHashMap<>();

    StateNames(int maxLength) {
        this.maxLength = maxLength;
    }

    /**
     * @return the name of the state compiled from {@code stmt}, stable across calls
     */
    String of(Statement stmt) {
        return assigned.computeIfAbsent(stmt, s -> unique(describe(s)));
    }

    String unique(String base) {
        String name = truncate(base, maxLength);
        for (int i = 1; !used.add(name); i++) {
            String suffix = " " + i;
            name = truncate(base, maxLength - suffix.length()) + suffix;
        }
        return name;
    }

    private static String truncate(String text, int length) {
        return text.length() <= length ? text : text.substring(0, length);
    }

    static String describe(Statement stmt) {
        if (stmt instanceof VariableDeclaration decl) {
            return decl.kind() + " " + decl.name() + (decl.init() == null ? "" : " = " + print(decl.init()));
        } else if (stmt instanceof ExpressionStatement es) {
            return print(es.expression());
        } else if (stmt instanceof ReturnStatement ret) {
            return ret.argument() == null ? "return" : "return " + print(ret.argument());
        } else if (stmt instanceof ThrowStatement thr) {
            return "throw " + print(thr.argument());
        } else if (stmt instanceof IfStatement ifStmt) {
            return "if(" + print(ifStmt.test()) + ")";
        } else if (stmt instanceof WhileStatement loop) {
            return "while (" + print(loop.test()) + ")";
        } else if (stmt instanceof DoWhileStatement loop) {
            return "while (" + print(loop.test()) + ")";
        } else if (stmt instanceof ForOfStatement loop) {
            return "for(" + loop.left().name() + " of " + print(loop.right()) + ")";
        } else if (stmt instanceof ForInStatement loop) {
            return "for(" + loop.left().name() + " in " + print(loop.right()) + ")";
        } else if (stmt instanceof BreakStatement) {
            return "break";
        } else if (stmt instanceof ContinueStatement) {
            return "continue";
        }
        return stmt.type();
    }

    static String print(Expression expr) {
        if (expr instanceof Identifier id) {
            return id.name();
        } else if (expr instanceof ReferenceExpression ref) {
            return ref.name();
        } else if (expr instanceof Literal literal) {
            Object value = literal.value();
            if (value instanceof String s) {
                return "\"" + s + "\"";
            } else if (value instanceof Number n) {
                return JsNumbers.format(n);
            }
            return String.valueOf(value);
        } else if (expr instanceof MemberExpression member) {
            return member.computed()
                ? print(member.object()) + "[" + print(member.property()) + "]"
                : print(member.object()) + "." + member.propertyName();
        } else if (expr instanceof CallExpression call) {
            return print(call.callee()) + "(" + printAll(call.arguments()) + ")";
        } else if (expr instanceof NewExpression ctor) {
            return "new " + print(ctor.callee()) + "(" + printAll(ctor.arguments()) + ")";
        } else if (expr instanceof UnaryExpression unary) {
            return "typeof".equals(unary.operator())
                ? "typeof " + print(unary.argument())
                : unary.operator() + print(unary.argument());
        } else if (expr instanceof BinaryExpression binary) {
            return print(binary.left()) + " " + binary.operator() + " " + print(binary.right());
        } else if (expr instanceof LogicalExpression logical) {
            return print(logical.left()) + " " + logical.operator() + " " + print(logical.right());
        } else if (expr instanceof ConditionalExpression cond) {
            return print(cond.test()) + " ? " + print(cond.consequent()) + " : " + print(cond.alternate());
        } else if (expr instanceof AssignmentExpression assign) {
            return print(assign.left()) + " = " + print(assign.right());
        } else if (expr instanceof ArrayExpression array) {
            return "[" + printAll(array.elements()) + "]";
        } else if (expr instanceof ObjectExpression object) {
            return "{" + printAll(object.properties()) + "}";
        } else if (expr instanceof Property property) {
            String key = property.staticKey() != null ? property.staticKey() : "[" + print(property.key()) + "]";
            return key + ": " + print(property.value());
        } else if (expr instanceof SpreadElement spread) {
            return "..." + print(spread.argument());
        } else if (expr instanceof TemplateLiteral template) {
            StringBuilder out = new StringBuilder("`");
            for (Expression part : template.parts()) {
                if (part instanceof Literal literal && literal.isString()) {
                    out.append(literal.value());
                } else {
                    out.append("${").append(print(part)).append('}');
                }
            }
            return out.append('`').toString();
        } else if (expr instanceof ArrowFunctionExpression fn) {
            return "function(" + fn.params().stream().map(Parameter::name).collect(Collectors.joining(", ")) + ")";
        }
        return expr.type();
    }

    private static String printAll(List<? extends Expression> exprs) {
        return exprs.stream().map(StateNames::print).collect(Collectors.joining(", "));
    }
}
