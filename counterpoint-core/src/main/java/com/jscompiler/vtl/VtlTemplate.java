package com.jscompiler.vtl;

import com.jscompiler.CompilationException;
import com.jscompiler.ErrorKind;
import com.jscompiler.ast.ArrayExpression;
import com.jscompiler.ast.ArrowFunctionExpression;
import com.jscompiler.ast.AssignmentExpression;
import com.jscompiler.ast.BinaryExpression;
import com.jscompiler.ast.BlockStatement;
import com.jscompiler.ast.BreakStatement;
import com.jscompiler.ast.CallExpression;
import com.jscompiler.ast.ConditionalExpression;
import com.jscompiler.ast.EmptyStatement;
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
import com.jscompiler.ast.Node;
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
import com.jscompiler.fold.Constant;
import com.jscompiler.service.ComputeFunction;
import com.jscompiler.service.ExecutionArguments;
import com.jscompiler.service.KeyValueStore;
import com.jscompiler.service.Service;
import com.jscompiler.service.ServiceCalls;
import com.jscompiler.service.WorkflowOrchestrator;
import com.jscompiler.util.JsNumbers;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * A mapping template under construction, and the evaluator that appends the
 * translation of statements and expressions to it.
 *
 * <p>{@code eval} returns the template expression denoting a value; anything the value
 * needs computed first (object literals, interpolations, loops) is appended as
 * directives before the caller uses the returned text.</p>
 *
 * <p>Bindings map as follows: the resolver's first parameter is {@code $context},
 * further parameters read {@code $context.arguments}, locals live in
 * {@code $context.stash}, and parameters of inline callbacks and loop variables are
 * plain template variables.</p>
 */
public final class VtlTemplate {

    /**
     * Short-circuits a template once an earlier stage has set the return flag.
     */
    public static final String CIRCUIT_BREAKER =
        "#if($context.stash.return__flag)\n  #return($context.stash.return__val)\n#end";

    private static final Pattern SIMPLE_REFERENCE = Pattern.compile("\\$[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)*");

    private final ResolverScope scope;
    private final List<String> lines = new ArrayList<>();
    private int varCount;
    private int callbackDepth;

    VtlTemplate(ResolverScope scope, String... preamble) {
        this.scope = scope;
        for (String line : preamble) {
            lines.add(line);
        }
    }

    public String toVtl() {
        return String.join("\n", lines);
    }

    // ========================================================================
    // Output primitives
    // ========================================================================

    void add(String line) {
        lines.add(line);
    }

    /**
     * Declares a fresh template variable initialized to {@code init}.
     */
    String var(String init) {
        String name = "$v" + (++varCount);
        add("#set(" + name + " = " + init + ")");
        return name;
    }

    void qr(String expr) {
        add("$util.qr(" + expr + ")");
    }

    void put(String object, String key, String value) {
        qr(object + ".put(" + key + ", " + value + ")");
    }

    static String str(String text) {
        return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + "\"";
    }

    void doReturn(Expression expr) {
        add("#return(" + eval(expr) + ")");
    }

    void doReturn(String text) {
        add("#return(" + text + ")");
    }

    // ========================================================================
    // Service requests
    // ========================================================================

    /**
     * Appends the request a service call sends to its backend.
     */
    void call(CallExpression call) {
        Service service = scope.calls().resolveCallee(call)
            .orElseThrow(() -> new CompilationException(ErrorKind.UNSUPPORTED_SERVICE,
                "callee does not resolve to a service", call));
        String method = ServiceCalls.methodOf(call);
        String version = scope.options().templateVersion();

        if (service instanceof KeyValueStore) {
            if (method == null || !KeyValueStore.METHODS.contains(method)) {
                throw new CompilationException(ErrorKind.UNSUPPORTED_SERVICE,
                    "unsupported table operation '" + method + "', expected one of " + KeyValueStore.METHODS, call);
            }
            Expression arg = call.argument(0);
            String request = arg instanceof ObjectExpression ? eval(arg) : var(arg == null ? "{}" : eval(arg));
            put(request, str("version"), str(version));
            put(request, str("operation"), str(KeyValueStore.operationOf(method)));
            add("$util.toJson(" + request + ")");
        } else if (service instanceof ComputeFunction) {
            if (method != null) {
                throw new CompilationException(ErrorKind.UNSUPPORTED_SERVICE,
                    "a function is invoked directly, not through '" + method + "'", call);
            }
            Expression arg = call.argument(0);
            String payload = arg == null ? "null" : "$util.toJson(" + eval(arg) + ")";
            add("{\n"
                + "  \"version\": \"" + version + "\",\n"
                + "  \"operation\": \"Invoke\",\n"
                + "  \"payload\": " + payload + "\n"
                + "}");
        } else if (service instanceof WorkflowOrchestrator workflow) {
            if (method != null) {
                throw new CompilationException(ErrorKind.UNSUPPORTED_SERVICE,
                    "'" + method + "' is not available in a resolver, only starting an execution is", call);
            }
            ExecutionArguments args = ExecutionArguments.of(call);
            String body = var("{}");
            if (args.input() != null) {
                put(body, str("input"), "$util.toJson(" + eval(args.input()) + ")");
            }
            if (args.name() != null) {
                put(body, str("name"), eval(args.name()));
            }
            if (args.traceHeader() != null) {
                put(body, str("traceHeader"), eval(args.traceHeader()));
            }
            put(body, str("stateMachineArn"), str(workflow.stateMachineArn()));
            String target = workflow.isExpress()
                ? "AWSStepFunctions.StartSyncExecution"
                : "AWSStepFunctions.StartExecution";
            add("{\n"
                + "  \"version\": \"" + version + "\",\n"
                + "  \"method\": \"POST\",\n"
                + "  \"resourcePath\": \"/\",\n"
                + "  \"params\": {\n"
                + "    \"headers\": {\n"
                + "      \"content-type\": \"application/x-amz-json-1.0\",\n"
                + "      \"x-amz-target\": \"" + target + "\"\n"
                + "    },\n"
                + "    \"body\": $util.toJson(" + body + ")\n"
                + "  }\n"
                + "}");
        }
    }

    // ========================================================================
    // Statements
    // ========================================================================

    void evalStatement(Statement stmt) {
        if (stmt instanceof ExpressionStatement es) {
            String value = eval(es.expression());
            if (!value.isEmpty()) {
                qr(value);
            }
        } else if (stmt instanceof VariableDeclaration decl) {
            String value = decl.init() == null ? "$null" : eval(decl.init());
            add("#set($context.stash." + decl.name() + " = " + value + ")");
        } else if (stmt instanceof ReturnStatement ret) {
            if (callbackDepth > 0) {
                throw new CompilationException(ErrorKind.UNSUPPORTED_SYNTAX,
                    "a callback may only return from its last statement", ret);
            }
            doReturn(ret.argument() == null ? "$null" : eval(ret.argument()));
        } else if (stmt instanceof IfStatement ifStmt) {
            add("#if(" + eval(ifStmt.test()) + ")");
            evalStatement(ifStmt.consequent());
            if (ifStmt.alternate() != null) {
                add("#else");
                evalStatement(ifStmt.alternate());
            }
            add("#end");
        } else if (stmt instanceof BlockStatement block) {
            for (Statement inner : block.body()) {
                evalStatement(inner);
            }
        } else if (stmt instanceof ForOfStatement loop) {
            add("#foreach($" + loop.left().name() + " in " + eval(loop.right()) + ")");
            evalStatement(loop.body());
            add("#end");
        } else if (stmt instanceof ForInStatement loop) {
            add("#foreach($" + loop.left().name() + " in " + eval(loop.right()) + ".keySet())");
            evalStatement(loop.body());
            add("#end");
        } else if (stmt instanceof ThrowStatement thr) {
            add(raise(thr.argument()));
        } else if (stmt instanceof BreakStatement) {
            add("#break");
        } else if (stmt instanceof EmptyStatement) {
            return;
        } else {
            throw new CompilationException(ErrorKind.UNSUPPORTED_SYNTAX,
                stmt.type() + " cannot be expressed in a mapping template", stmt);
        }
    }

    private String raise(Expression error) {
        if (error instanceof NewExpression created && created.callee() instanceof Identifier ctor
            && ctor.name().endsWith("Error")) {
            Expression message = created.arguments().isEmpty() ? null : created.arguments().get(0);
            return "$util.error(" + (message == null ? "$null" : eval(message)) + ", " + str(ctor.name()) + ")";
        }
        return "$util.error($util.toJson(" + eval(error) + "))";
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    String eval(Expression expr) {
        if (expr instanceof Literal literal) {
            return literal(literal.value());
        } else if (expr instanceof Identifier id) {
            return reference(id);
        } else if (expr instanceof ReferenceExpression ref) {
            return external(ref);
        } else if (expr instanceof MemberExpression member) {
            return access(member);
        } else if (expr instanceof CallExpression call) {
            return evalCall(call);
        } else if (expr instanceof UnaryExpression unary) {
            return unary(unary);
        } else if (expr instanceof BinaryExpression binary) {
            return binary(binary);
        } else if (expr instanceof LogicalExpression logical) {
            String left = eval(logical.left());
            String right = eval(logical.right());
            if ("??".equals(logical.operator())) {
                return "$util.defaultIfNull(" + left + ", " + right + ")";
            }
            return "(" + left + " " + logical.operator() + " " + right + ")";
        } else if (expr instanceof ConditionalExpression cond) {
            String result = var("$null");
            add("#if(" + eval(cond.test()) + ")");
            add("#set(" + result + " = " + eval(cond.consequent()) + ")");
            add("#else");
            add("#set(" + result + " = " + eval(cond.alternate()) + ")");
            add("#end");
            return result;
        } else if (expr instanceof AssignmentExpression assign) {
            assign(assign);
            return "";
        } else if (expr instanceof ObjectExpression object) {
            return object(object);
        } else if (expr instanceof ArrayExpression array) {
            String list = var("[]");
            for (Expression element : array.elements()) {
                if (element instanceof SpreadElement spread) {
                    qr(list + ".addAll(" + eval(spread.argument()) + ")");
                } else {
                    qr(list + ".add(" + eval(element) + ")");
                }
            }
            return list;
        } else if (expr instanceof TemplateLiteral template) {
            return interpolate(template.parts());
        }
        throw new CompilationException(ErrorKind.UNSUPPORTED_SYNTAX,
            expr.type() + " cannot be expressed in a mapping template", expr);
    }

    private static String literal(Object value) {
        if (value == null) {
            return "$null";
        } else if (value instanceof String s) {
            return str(s);
        } else if (value instanceof Number n) {
            return JsNumbers.format(n);
        }
        return String.valueOf(value);
    }

    private String reference(Identifier id) {
        if ("undefined".equals(id.name())) {
            return "$null";
        }
        Map<String, Node> visible = scope.flow().getLexicalScope(id);
        Node binding = visible.get(id.name());
        if (binding == null) {
            if (id.name().startsWith("$")) {
                return id.name();
            }
            throw new CompilationException(ErrorKind.INVALID_REFERENCE,
                "'" + id.name() + "' is not bound in the resolver", id);
        }
        Node owner = scope.tree().parent(binding).orElse(null);
        if (binding instanceof Parameter) {
            if (owner != scope.function()) {
                return "$" + id.name();
            }
            return scope.function().params().get(0) == binding ? "$context" : "$context.arguments." + id.name();
        }
        if (owner instanceof ForOfStatement || owner instanceof ForInStatement) {
            return "$" + id.name();
        }
        return "$context.stash." + id.name();
    }

    private String external(ReferenceExpression ref) {
        Object value = scope.calls().references().resolve(ref);
        if (value instanceof Service) {
            throw new CompilationException(ErrorKind.UNSUPPORTED_CALL_POSITION,
                "a service can only be called, not used as a value", ref);
        }
        Constant constant = new Constant(value);
        if (!constant.isPrimitive()) {
            throw new CompilationException(ErrorKind.INVALID_REFERENCE,
                "'" + ref.name() + "' does not resolve to a primitive value", ref);
        }
        return literal(value instanceof Enum<?> ? null : value);
    }

    private String access(MemberExpression member) {
        if (rootedAtReference(member)) {
            Optional<Constant> constant = scope.folder().evalToConstant(member);
            if (constant.isPresent() && constant.get().isPrimitive()) {
                Object value = constant.get().value();
                return literal(value instanceof Enum<?> ? null : value);
            }
        }
        if (member.computed()) {
            return eval(member.object()) + "[" + eval(member.property()) + "]";
        }
        return eval(member.object()) + "." + member.propertyName();
    }

    private static boolean rootedAtReference(Expression expr) {
        if (expr instanceof MemberExpression member) {
            return rootedAtReference(member.object());
        }
        return expr instanceof ReferenceExpression;
    }

    private String unary(UnaryExpression unary) {
        String operand = eval(unary.argument());
        return switch (unary.operator()) {
            case "!" -> "!" + operand;
            case "-" -> "-" + operand;
            case "+" -> operand;
            case "typeof" -> "$util.typeOf(" + operand + ")";
            default -> throw new CompilationException(ErrorKind.UNSUPPORTED_SYNTAX,
                "unary operator " + unary.operator() + " is not supported", unary);
        };
    }

    private String binary(BinaryExpression binary) {
        if ("+".equals(binary.operator()) && isStringTyped(binary)) {
            List<Expression> parts = new ArrayList<>();
            concatenation(binary, parts);
            return interpolate(parts);
        }
        String left = eval(binary.left());
        String right = eval(binary.right());
        return switch (binary.operator()) {
            case "===", "==" -> "(" + left + " == " + right + ")";
            case "!==", "!=" -> "(" + left + " != " + right + ")";
            case "<", "<=", ">", ">=", "+", "-", "*", "/", "%" ->
                "(" + left + " " + binary.operator() + " " + right + ")";
            case "in" -> right + ".containsKey(" + left + ")";
            default -> throw new CompilationException(ErrorKind.UNSUPPORTED_SYNTAX,
                "binary operator " + binary.operator() + " is not supported", binary);
        };
    }

    private static boolean isStringTyped(Expression expr) {
        if (expr instanceof Literal literal) {
            return literal.isString();
        } else if (expr instanceof TemplateLiteral) {
            return true;
        } else if (expr instanceof BinaryExpression binary && "+".equals(binary.operator())) {
            return isStringTyped(binary.left()) || isStringTyped(binary.right());
        }
        return false;
    }

    private static void concatenation(Expression expr, List<Expression> parts) {
        if (expr instanceof BinaryExpression binary && "+".equals(binary.operator())) {
            concatenation(binary.left(), parts);
            concatenation(binary.right(), parts);
        } else if (expr instanceof TemplateLiteral template) {
            parts.addAll(template.parts());
        } else {
            parts.add(expr);
        }
    }

    /**
     * Builds a string from text and value parts with a single interpolated literal.
     */
    private String interpolate(List<Expression> parts) {
        StringBuilder text = new StringBuilder();
        for (Expression part : parts) {
            if (part instanceof Literal literal && literal.isString()) {
                text.append(((String) literal.value()).replace("\\", "\\\\").replace("\"", "\\\""));
                continue;
            }
            String value = eval(part);
            if (!SIMPLE_REFERENCE.matcher(value).matches()) {
                value = var(value);
            }
            text.append("${").append(value.substring(1)).append('}');
        }
        return var("\"" + text + "\"");
    }

    private String object(ObjectExpression object) {
        String map = var("{}");
        for (Expression member : object.properties()) {
            if (member instanceof Property property) {
                String key = property.computed() || property.staticKey() == null
                    ? eval(property.key())
                    : str(property.staticKey());
                put(map, key, eval(property.value()));
            } else if (member instanceof SpreadElement spread) {
                qr(map + ".putAll(" + eval(spread.argument()) + ")");
            }
        }
        return map;
    }

    private void assign(AssignmentExpression assign) {
        if (!"=".equals(assign.operator())) {
            throw new CompilationException(ErrorKind.UNSUPPORTED_SYNTAX,
                "only plain assignment is supported, found " + assign.operator(), assign);
        }
        if (assign.left() instanceof MemberExpression member) {
            String key = member.computed() ? eval(member.property()) : str(member.propertyName());
            put(eval(member.object()), key, eval(assign.right()));
        } else if (assign.left() instanceof Identifier) {
            add("#set(" + eval(assign.left()) + " = " + eval(assign.right()) + ")");
        } else {
            throw new CompilationException(ErrorKind.UNSUPPORTED_SYNTAX,
                "cannot assign to " + assign.left().type(), assign);
        }
    }

    // ========================================================================
    // Calls
    // ========================================================================

    private String evalCall(CallExpression call) {
        if (scope.calls().resolveCallee(call).isPresent()) {
            throw new CompilationException(ErrorKind.UNSUPPORTED_CALL_POSITION,
                "a service can only be called from a variable declaration, an expression statement or a return", call);
        }
        if (!(call.callee() instanceof MemberExpression callee) || callee.computed()) {
            throw new CompilationException(ErrorKind.UNSUPPORTED_SYNTAX,
                "only methods of values, $util and JSON can be called in a mapping template", call);
        }
        String method = callee.propertyName();
        if (callee.object() instanceof Identifier owner && isGlobal(owner)) {
            if ("$SFN".equals(owner.name())) {
                throw new CompilationException(ErrorKind.CONTEXT_MISMATCH,
                    "$SFN." + method + " is only available in a state machine", call);
            } else if ("JSON".equals(owner.name())) {
                return json(call, method);
            }
        }
        if (call.argument(0) instanceof ArrowFunctionExpression callback
            && ("map".equals(method) || "filter".equals(method) || "forEach".equals(method))) {
            return iterate(eval(callee.object()), method, callback);
        }
        List<String> args = new ArrayList<>();
        for (Expression arg : call.arguments()) {
            args.add(eval(arg));
        }
        return eval(callee) + "(" + String.join(", ", args) + ")";
    }

    private boolean isGlobal(Identifier id) {
        return !scope.flow().getLexicalScope(id).containsKey(id.name());
    }

    private String json(CallExpression call, String method) {
        Expression arg = call.argument(0);
        if (arg == null) {
            throw new CompilationException(ErrorKind.INVALID_ARGUMENT, "JSON." + method + " requires an argument", call);
        }
        if ("stringify".equals(method)) {
            return "$util.toJson(" + eval(arg) + ")";
        } else if ("parse".equals(method)) {
            return "$util.parseJson(" + eval(arg) + ")";
        }
        throw new CompilationException(ErrorKind.UNSUPPORTED_SYNTAX, "JSON." + method + " is not supported", call);
    }

    private String iterate(String list, String method, ArrowFunctionExpression callback) {
        List<Parameter> params = callback.params();
        String item = params.isEmpty() ? "$i" + (++varCount) : "$" + params.get(0).name();
        String result = "forEach".equals(method) ? "" : var("[]");

        List<Statement> body = callback.body().body();
        ReturnStatement last = null;
        if (!"forEach".equals(method)) {
            if (body.isEmpty() || !(body.get(body.size() - 1) instanceof ReturnStatement ret) || ret.argument() == null) {
                throw new CompilationException(ErrorKind.MISSING_RETURN,
                    "the callback of " + method + " must end with a return", callback);
            }
            last = ret;
            body = body.subList(0, body.size() - 1);
        }

        add("#foreach(" + item + " in " + list + ")");
        if (params.size() > 1) {
            add("#set($" + params.get(1).name() + " = $foreach.index)");
        }
        if (params.size() > 2) {
            add("#set($" + params.get(2).name() + " = " + list + ")");
        }
        callbackDepth++;
        try {
            for (Statement stmt : body) {
                evalStatement(stmt);
            }
            if ("map".equals(method)) {
                qr(result + ".add(" + eval(last.argument()) + ")");
            } else if ("filter".equals(method)) {
                add("#if(" + eval(last.argument()) + ")");
                qr(result + ".add(" + item + ")");
                add("#end");
            }
        } finally {
            callbackDepth--;
        }
        add("#end");
        return result;
    }
}
