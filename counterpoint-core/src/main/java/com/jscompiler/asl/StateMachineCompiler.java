package com.jscompiler.asl;

import com.jscompiler.CompilationException;
import com.jscompiler.CompilerOptions;
import com.jscompiler.ErrorKind;
import com.jscompiler.ast.ArrowFunctionExpression;
import com.jscompiler.ast.AssignmentExpression;
import com.jscompiler.ast.BlockStatement;
import com.jscompiler.ast.BreakStatement;
import com.jscompiler.ast.CallExpression;
import com.jscompiler.ast.CatchClause;
import com.jscompiler.ast.ContinueStatement;
import com.jscompiler.ast.DoWhileStatement;
import com.jscompiler.ast.EmptyStatement;
import com.jscompiler.ast.Expression;
import com.jscompiler.ast.ExpressionStatement;
import com.jscompiler.ast.ForInStatement;
import com.jscompiler.ast.ForOfStatement;
import com.jscompiler.ast.FunctionDeclaration;
import com.jscompiler.ast.Identifier;
import com.jscompiler.ast.IfStatement;
import com.jscompiler.ast.Literal;
import com.jscompiler.ast.MemberExpression;
import com.jscompiler.ast.NewExpression;
import com.jscompiler.ast.Node;
import com.jscompiler.ast.ObjectExpression;
import com.jscompiler.ast.Parameter;
import com.jscompiler.ast.Property;
import com.jscompiler.ast.ReturnStatement;
import com.jscompiler.ast.Statement;
import com.jscompiler.ast.SyntaxTree;
import com.jscompiler.ast.ThrowStatement;
import com.jscompiler.ast.TryStatement;
import com.jscompiler.ast.VariableDeclaration;
import com.jscompiler.ast.WhileStatement;
import com.jscompiler.flow.ControlFlow;
import com.jscompiler.fold.Constant;
import com.jscompiler.fold.ConstantFolder;
import com.jscompiler.service.ComputeFunction;
import com.jscompiler.service.ExecutionArguments;
import com.jscompiler.service.ExternalReferences;
import com.jscompiler.service.KeyValueStore;
import com.jscompiler.service.Service;
import com.jscompiler.service.ServiceCalls;
import com.jscompiler.service.WorkflowOrchestrator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Compiles a workflow function into a state machine.
 *
 * <p>Every statement with an effect becomes one state named after its source, and
 * transitions follow {@link ControlFlow}: a state's {@code Next} is the statement its
 * exit leads to. Variables live in the state's data at {@code $.name}; the first
 * parameter is seeded from the execution input.</p>
 *
 * <p>Loops over arrays and the {@code $SFN.map}, {@code $SFN.forEach} and
 * {@code $SFN.parallel} intrinsics compile their bodies into nested graphs. A nested
 * graph ends wherever control would leave its body.</p>
 */
public final class StateMachineCompiler {

    private static final Logger LOG = Logger.getLogger(StateMachineCompiler.class.getName());

    static final String INTRINSICS = "$SFN";
    static final String DONE = "Done";

    private final ExternalReferences references;
    private final CompilerOptions options;

    public StateMachineCompiler(ExternalReferences references, CompilerOptions options) {
        this.references = references;
        this.options = options;
    }

    public StateMachine compile(FunctionDeclaration function) {
        StateMachine machine = new Compilation(function).run();
        LOG.info(() -> "compiled state machine " + (function.name() == null ? "<anonymous>" : function.name())
            + " with " + machine.states().size() + " top-level state(s)");
        return machine;
    }

    /**
     * The states of one graph under construction and the node bounding it. Control
     * leaving the bounding node ends the graph.
     */
    private final class Graph {

        private final Node root;
        private final Map<String, State> states = new LinkedHashMap<>();
        private final Compilation compilation;
        private String done;

        Graph(Compilation compilation, Node root) {
            this.compilation = compilation;
            this.root = root;
        }

        boolean encloses(Statement stmt) {
            return stmt == root || compilation.tree.contains(root, stmt);
        }

        void put(String name, State state) {
            states.put(name, state);
            LOG.fine(() -> "state '" + name + "': " + state.type());
        }

        /**
         * @return the name of the state {@code successor} compiles to, or of a final
         *         state when control leaves the graph
         */
        String target(Optional<Statement> successor) {
            if (successor.isPresent() && encloses(successor.get())) {
                return compilation.names.of(successor.get());
            }
            if (done == null) {
                done = compilation.names.unique(DONE);
                put(done, new SucceedState());
            }
            return done;
        }

        Transition transition(Optional<Statement> successor) {
            if (successor.isPresent() && encloses(successor.get())) {
                return new Transition(compilation.names.of(successor.get()), null);
            }
            return Transition.END;
        }
    }

    private record Transition(String next, Boolean end) {
        static final Transition END = new Transition(null, Boolean.TRUE);
    }

    private final class Compilation {

        private final FunctionDeclaration function;
        private final SyntaxTree tree;
        private final ControlFlow flow;
        private final ServiceCalls calls;
        private final ConstantFolder folder;
        private final DataPaths paths;
        private final StateNames names;

        Compilation(FunctionDeclaration function) {
            this.function = function;
            this.tree = SyntaxTree.of(function);
            this.flow = new ControlFlow(tree);
            this.calls = new ServiceCalls(references);
            this.folder = new ConstantFolder(references);
            this.paths = new DataPaths(folder);
            this.names = new StateNames(options.maxStateNameLength());
        }

        StateMachine run() {
            Graph graph = new Graph(this, function.body());
            if (function.params().isEmpty()) {
                String start = graph.target(flow.step(function.body()));
                compileInto(graph, function.body());
                return new StateMachine(start, graph.states);
            }
            Parameter input = function.params().get(0);
            String init = names.unique("Initialize " + input.name());
            Map<String, Object> parameters = new LinkedHashMap<>();
            parameters.put(input.name() + ".$", "$");
            // reserve the initial state's position before the body's states
            graph.states.put(init, PassState.to(null));
            String start = graph.target(flow.step(function.body()));
            graph.put(init, new PassState(null, parameters, null, ResultPath.ROOT, start, null));
            compileInto(graph, function.body());
            return new StateMachine(init, graph.states);
        }

        StateMachine subGraph(Statement root) {
            Graph graph = new Graph(this, root);
            String start = graph.target(flow.step(root));
            compileInto(graph, root);
            return new StateMachine(start, graph.states);
        }

        // ====================================================================
        // Statements
        // ====================================================================

        void compileInto(Graph graph, Statement stmt) {
            if (stmt instanceof BlockStatement block) {
                for (Statement inner : block.body()) {
                    compileInto(graph, inner);
                }
            } else if (stmt instanceof TryStatement tryStmt) {
                compileInto(graph, tryStmt.block());
                if (tryStmt.handler() != null) {
                    compileInto(graph, tryStmt.handler().body());
                }
                if (tryStmt.finalizer() != null) {
                    compileInto(graph, tryStmt.finalizer());
                }
            } else if (stmt instanceof CatchClause clause) {
                compileInto(graph, clause.body());
            } else if (stmt instanceof VariableDeclaration decl && decl.init() == null) {
                // declared only; nothing to store
            } else {
                graph.put(names.of(stmt), compileState(graph, stmt));
                if (stmt instanceof IfStatement ifStmt) {
                    compileInto(graph, ifStmt.consequent());
                    if (ifStmt.alternate() != null) {
                        compileInto(graph, ifStmt.alternate());
                    }
                } else if (stmt instanceof WhileStatement loop) {
                    compileInto(graph, loop.body());
                } else if (stmt instanceof DoWhileStatement loop) {
                    compileInto(graph, loop.body());
                }
            }
        }

        private State compileState(Graph graph, Statement stmt) {
            if (stmt instanceof ExpressionStatement es) {
                Expression expr = es.expression();
                if (expr instanceof AssignmentExpression assign) {
                    if (!"=".equals(assign.operator())) {
                        throw new CompilationException(ErrorKind.UNSUPPORTED_SYNTAX,
                            "only plain assignment is supported, found " + assign.operator(), assign);
                    }
                    return store(graph, stmt, assign.right(), ResultPath.of(paths.toJsonPath(assign.left())),
                        graph.transition(flow.exit(stmt)));
                } else if (expr instanceof CallExpression call) {
                    return store(graph, stmt, call, ResultPath.DISCARD, graph.transition(flow.exit(stmt)));
                }
                Transition next = graph.transition(flow.exit(stmt));
                return new PassState(null, null, null, null, next.next(), next.end());
            } else if (stmt instanceof VariableDeclaration decl) {
                return store(graph, stmt, decl.init(), ResultPath.of("$." + decl.name()),
                    graph.transition(flow.exit(stmt)));
            } else if (stmt instanceof ReturnStatement ret) {
                if (ret.argument() == null) {
                    return new SucceedState();
                }
                return store(graph, stmt, ret.argument(), null, Transition.END);
            } else if (stmt instanceof ThrowStatement thr) {
                return compileThrow(graph, thr);
            } else if (stmt instanceof IfStatement ifStmt) {
                String otherwise = graph.target(ifStmt.alternate() != null
                    ? flow.step(ifStmt.alternate())
                    : flow.exit(ifStmt));
                return new ChoiceState(List.of(choice(ifStmt.test(), graph.target(flow.step(ifStmt.consequent())))),
                    otherwise);
            } else if (stmt instanceof WhileStatement loop) {
                return new ChoiceState(List.of(choice(loop.test(), graph.target(flow.step(loop.body())))),
                    graph.target(flow.exit(loop)));
            } else if (stmt instanceof DoWhileStatement loop) {
                return new ChoiceState(List.of(choice(loop.test(), graph.target(flow.step(loop.body())))),
                    graph.target(flow.exit(loop)));
            } else if (stmt instanceof ForOfStatement loop) {
                return compileForOf(graph, loop);
            } else if (stmt instanceof ForInStatement) {
                throw new CompilationException(ErrorKind.UNSUPPORTED_SYNTAX,
                    "for-in loops are not supported in a state machine", stmt);
            } else if (stmt instanceof BreakStatement) {
                Statement loop = enclosingLoop(stmt);
                if (loop instanceof ForOfStatement) {
                    throw new CompilationException(ErrorKind.UNSUPPORTED_SYNTAX,
                        "break is not supported inside a for-of loop", stmt);
                }
                return PassState.to(graph.transition(flow.exit(loop)).next());
            } else if (stmt instanceof ContinueStatement) {
                return PassState.to(graph.transition(Optional.of(enclosingLoop(stmt))).next());
            } else if (stmt instanceof EmptyStatement) {
                return PassState.to(graph.transition(flow.exit(stmt)).next());
            }
            throw new CompilationException(ErrorKind.UNSUPPORTED_SYNTAX,
                stmt.type() + " cannot be compiled to a state", stmt);
        }

        private Statement enclosingLoop(Statement stmt) {
            return (Statement) tree.findParent(stmt, n -> n instanceof WhileStatement
                    || n instanceof DoWhileStatement || n instanceof ForOfStatement)
                .orElseThrow(() -> new CompilationException(ErrorKind.UNSUPPORTED_SYNTAX,
                    stmt.type() + " outside of a loop", stmt));
        }

        private Map<String, Object> choice(Expression test, String next) {
            if (calls.findServiceCall(test).isPresent()) {
                throw new CompilationException(ErrorKind.UNSUPPORTED_CALL_POSITION,
                    "a condition cannot call a service", test);
            }
            Map<String, Object> rule = new LinkedHashMap<>(paths.condition(test));
            rule.put("Next", next);
            return rule;
        }

        /**
         * Compiles a statement that writes {@code value} to {@code resultPath}; a null
         * result path makes the value the state's whole output.
         */
        private State store(Graph graph, Statement stmt, Expression value, ResultPath resultPath, Transition next) {
            if (value instanceof CallExpression call) {
                if (isIntrinsic(call)) {
                    return intrinsic(graph, stmt, call, resultPath, next);
                }
                Optional<Service> service = calls.resolveCallee(call);
                if (service.isPresent()) {
                    return task(graph, stmt, call, service.get(), resultPath, next);
                }
            }
            if (calls.findServiceCall(value).isPresent()) {
                throw new CompilationException(ErrorKind.UNSUPPORTED_CALL_POSITION,
                    "a service call's result must be stored or returned directly", value);
            }
            Optional<Object> constant = paths.constantValue(value);
            if (constant.isPresent()) {
                return new PassState(null, null, constant.get(), resultPath, next.next(), next.end());
            } else if (paths.isPath(value)) {
                return new PassState(paths.toJsonPath(value), null, null, resultPath, next.next(), next.end());
            } else if (value instanceof ObjectExpression object) {
                return new PassState(null, paths.parametersOf(object), null, resultPath, next.next(), next.end());
            }
            throw new CompilationException(ErrorKind.INVALID_ARGUMENT,
                value.type() + " can only be stored inside an object literal", value);
        }

        private State compileThrow(Graph graph, ThrowStatement thr) {
            if (!(thr.argument() instanceof NewExpression error) || !(error.callee() instanceof Identifier ctor)) {
                throw new CompilationException(ErrorKind.INVALID_ARGUMENT,
                    "only new errors can be thrown, e.g. throw new Error(\"message\")", thr);
            }
            Expression message = error.arguments().isEmpty() ? null : error.arguments().get(0);
            Optional<Statement> handler = flow.throwTarget(thr).filter(graph::encloses);
            if (handler.isPresent()) {
                Map<String, Object> parameters = new LinkedHashMap<>();
                parameters.put("Error", ctor.name());
                if (message != null) {
                    paths.assign(parameters, "Cause", message);
                }
                return new PassState(null, parameters, null, handlerResultPath(handler.get()),
                    graph.target(flow.step(handler.get())), null);
            }
            String cause = null;
            if (message != null) {
                cause = folder.evalToConstant(message)
                    .filter(Constant::isPrimitive)
                    .map(Constant::asString)
                    .orElseThrow(() -> new CompilationException(ErrorKind.INVALID_ARGUMENT,
                        "the message of an uncaught error must be a constant", message));
            }
            return new FailState(ctor.name(), cause);
        }

        private ResultPath handlerResultPath(Statement handler) {
            if (handler instanceof CatchClause clause && clause.param() != null) {
                return ResultPath.of("$." + clause.param().name());
            }
            return ResultPath.DISCARD;
        }

        private List<CatchRule> catchRules(Graph graph, Statement stmt) {
            Optional<Statement> handler = flow.throwTarget(stmt).filter(graph::encloses);
            return handler
                .map(h -> List.of(CatchRule.all(handlerResultPath(h), graph.target(flow.step(h)))))
                .orElse(null);
        }

        private MapState compileForOf(Graph graph, ForOfStatement loop) {
            Map<String, Object> parameters = new LinkedHashMap<>();
            for (String name : flow.getVisibleNames(loop)) {
                if (!name.equals(loop.left().name())) {
                    parameters.put(name + ".$", "$." + name);
                }
            }
            parameters.put(loop.left().name() + ".$", "$$.Map.Item.Value");
            Transition next = graph.transition(flow.exit(loop));
            return new MapState(1, subGraph(loop.body()), paths.toJsonPath(loop.right()), parameters,
                ResultPath.DISCARD, catchRules(graph, loop), next.next(), next.end());
        }

        // ====================================================================
        // Service tasks
        // ====================================================================

        private TaskState task(Graph graph, Statement stmt, CallExpression call, Service service,
                               ResultPath resultPath, Transition next) {
            String method = ServiceCalls.methodOf(call);
            List<CatchRule> catches = catchRules(graph, stmt);
            if (service instanceof ComputeFunction function) {
                if (method != null) {
                    throw new CompilationException(ErrorKind.UNSUPPORTED_SERVICE,
                        "functions are invoked directly, found ." + method, call);
                }
                Expression arg = call.argument(0);
                if (arg == null) {
                    return new TaskState(function.functionArn(), null, new LinkedHashMap<>(), resultPath,
                        catches, next.next(), next.end());
                } else if (paths.isPath(arg)) {
                    return new TaskState(function.functionArn(), paths.toJsonPath(arg), null, resultPath,
                        catches, next.next(), next.end());
                } else if (arg instanceof ObjectExpression object) {
                    return new TaskState(function.functionArn(), null, paths.parametersOf(object), resultPath,
                        catches, next.next(), next.end());
                }
                throw new CompilationException(ErrorKind.INVALID_ARGUMENT,
                    "a function's input must be a variable or an object literal", arg);
            } else if (service instanceof KeyValueStore table) {
                if (method == null || !KeyValueStore.METHODS.contains(method)) {
                    throw new CompilationException(ErrorKind.UNSUPPORTED_SERVICE,
                        "unsupported table operation: " + method, call);
                }
                Map<String, Object> parameters = new LinkedHashMap<>();
                parameters.put("TableName", table.tableName());
                Expression arg = call.argument(0);
                if (arg instanceof ObjectExpression object) {
                    parameters.putAll(paths.parametersOf(object));
                } else if (arg != null) {
                    throw new CompilationException(ErrorKind.INVALID_ARGUMENT,
                        "table operations take an object literal", arg);
                }
                return new TaskState("arn:aws:states:::aws-sdk:dynamodb:" + method, null, parameters,
                    resultPath, catches, next.next(), next.end());
            }
            WorkflowOrchestrator workflow = (WorkflowOrchestrator) service;
            Map<String, Object> parameters = new LinkedHashMap<>();
            if (method == null) {
                ExecutionArguments args = ExecutionArguments.of(call);
                parameters.put("StateMachineArn", workflow.stateMachineArn());
                if (args.input() != null) {
                    paths.assign(parameters, "Input", args.input());
                }
                if (args.name() != null) {
                    paths.assign(parameters, "Name", args.name());
                }
                if (args.traceHeader() != null) {
                    paths.assign(parameters, "TraceHeader", args.traceHeader());
                }
                String action = workflow.isExpress() ? "startSyncExecution" : "startExecution";
                return new TaskState("arn:aws:states:::aws-sdk:sfn:" + action, null, parameters,
                    resultPath, catches, next.next(), next.end());
            } else if ("describeExecution".equals(method) && call.argument(0) != null) {
                paths.assign(parameters, "ExecutionArn", call.argument(0));
                return new TaskState("arn:aws:states:::aws-sdk:sfn:describeExecution", null, parameters,
                    resultPath, catches, next.next(), next.end());
            }
            throw new CompilationException(ErrorKind.UNSUPPORTED_SERVICE,
                "unsupported workflow operation: " + method, call);
        }

        // ====================================================================
        // $SFN intrinsics
        // ====================================================================

        private boolean isIntrinsic(CallExpression call) {
            return call.callee() instanceof MemberExpression callee
                && !callee.computed()
                && callee.object() instanceof Identifier owner
                && INTRINSICS.equals(owner.name())
                && !flow.getLexicalScope(call).containsKey(INTRINSICS);
        }

        private State intrinsic(Graph graph, Statement stmt, CallExpression call, ResultPath resultPath,
                                Transition next) {
            String method = ((MemberExpression) call.callee()).propertyName();
            return switch (method) {
                case "waitFor" -> waitFor(call, next);
                case "waitUntil" -> waitUntil(call, next);
                case "map" -> map(graph, stmt, call, resultPath, next);
                case "forEach" -> map(graph, stmt, call, ResultPath.DISCARD, next);
                case "parallel" -> parallel(graph, stmt, call, resultPath, next);
                default -> throw new CompilationException(ErrorKind.UNSUPPORTED_SYNTAX,
                    INTRINSICS + "." + method + " is not a known intrinsic", call);
            };
        }

        private WaitState waitFor(CallExpression call, Transition next) {
            Expression seconds = requireArgument(call, 0, "seconds");
            if (seconds instanceof Literal literal && literal.isNumber()) {
                return new WaitState((Number) literal.value(), null, null, null, next.next(), next.end());
            }
            return new WaitState(null, paths.toJsonPath(seconds), null, null, next.next(), next.end());
        }

        private WaitState waitUntil(CallExpression call, Transition next) {
            Expression timestamp = requireArgument(call, 0, "timestamp");
            if (timestamp instanceof Literal literal && literal.isString()) {
                return new WaitState(null, null, (String) literal.value(), null, next.next(), next.end());
            }
            return new WaitState(null, null, null, paths.toJsonPath(timestamp), next.next(), next.end());
        }

        private MapState map(Graph graph, Statement stmt, CallExpression call, ResultPath resultPath,
                             Transition next) {
            Expression array = requireArgument(call, 0, "array");
            Expression last = call.arguments().get(call.arguments().size() - 1);
            if (call.arguments().size() < 2 || !(last instanceof ArrowFunctionExpression callback)) {
                throw new CompilationException(ErrorKind.INVALID_ARGUMENT, "missing callbackfn in $SFN.map", call);
            }
            Integer maxConcurrency = null;
            if (call.arguments().size() == 3) {
                maxConcurrency = maxConcurrency(call.arguments().get(1));
            }
            String itemsPath = paths.toJsonPath(array);
            Map<String, Object> parameters = new LinkedHashMap<>();
            List<Parameter> params = callback.params();
            for (int i = 0; i < params.size(); i++) {
                String source = i == 0 ? "$$.Map.Item.Value" : i == 1 ? "$$.Map.Item.Index" : itemsPath;
                parameters.put(params.get(i).name() + ".$", source);
            }
            return new MapState(maxConcurrency, subGraph(callback.body()), itemsPath, parameters, resultPath,
                catchRules(graph, stmt), next.next(), next.end());
        }

        private Integer maxConcurrency(Expression props) {
            if (!(props instanceof ObjectExpression object)) {
                throw new CompilationException(ErrorKind.INVALID_CONCURRENCY,
                    "the map options must be an object literal", props);
            }
            Property property = object.getProperty("maxConcurrency");
            if (property == null) {
                throw new CompilationException(ErrorKind.INVALID_CONCURRENCY,
                    "the map options must set maxConcurrency", props);
            }
            if (property.value() instanceof Literal literal && literal.value() instanceof Number n
                && n.doubleValue() > 0 && n.doubleValue() == Math.rint(n.doubleValue())) {
                return n.intValue();
            }
            throw new CompilationException(ErrorKind.INVALID_CONCURRENCY,
                "maxConcurrency must be a literal number greater than 0", property);
        }

        private ParallelState parallel(Graph graph, Statement stmt, CallExpression call, ResultPath resultPath,
                                       Transition next) {
            if (call.arguments().isEmpty()) {
                throw new CompilationException(ErrorKind.INVALID_ARGUMENT,
                    "$SFN.parallel needs at least one branch", call);
            }
            List<StateMachine> branches = new ArrayList<>();
            for (Expression branch : call.arguments()) {
                if (!(branch instanceof ArrowFunctionExpression fn)) {
                    throw new CompilationException(ErrorKind.INVALID_BRANCH,
                        "each branch of $SFN.parallel must be an inline function", branch);
                }
                branches.add(subGraph(fn.body()));
            }
            return new ParallelState(branches, resultPath, catchRules(graph, stmt), next.next(), next.end());
        }

        private Expression requireArgument(CallExpression call, int index, String name) {
            Expression arg = call.argument(index);
            if (arg == null) {
                throw new CompilationException(ErrorKind.INVALID_ARGUMENT, "missing argument " + name, call);
            }
            return arg;
        }
    }
}
