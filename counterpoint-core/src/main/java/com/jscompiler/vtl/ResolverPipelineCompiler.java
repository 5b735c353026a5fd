package com.jscompiler.vtl;

import com.jscompiler.CompilationException;
import com.jscompiler.CompilerOptions;
import com.jscompiler.ErrorKind;
import com.jscompiler.ast.CallExpression;
import com.jscompiler.ast.Expression;
import com.jscompiler.ast.ExpressionStatement;
import com.jscompiler.ast.FunctionDeclaration;
import com.jscompiler.ast.Identifier;
import com.jscompiler.ast.IfStatement;
import com.jscompiler.ast.MemberExpression;
import com.jscompiler.ast.ReturnStatement;
import com.jscompiler.ast.Statement;
import com.jscompiler.ast.SyntaxTree;
import com.jscompiler.ast.VariableDeclaration;
import com.jscompiler.flow.ControlFlow;
import com.jscompiler.fold.Constant;
import com.jscompiler.fold.ConstantFolder;
import com.jscompiler.service.CompilationNamespace;
import com.jscompiler.service.ComputeFunction;
import com.jscompiler.service.ExternalReferences;
import com.jscompiler.service.KeyValueStore;
import com.jscompiler.service.Service;
import com.jscompiler.service.ServiceCalls;
import com.jscompiler.service.WorkflowOrchestrator;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Compiles a resolver function into a pipeline of mapping templates.
 *
 * <p>A body that calls no service becomes a unit resolver on the {@code None} data
 * source. Otherwise every statement calling a service closes a pipeline stage: the
 * template accumulated so far becomes the stage's request, and the stage's response
 * stores the result in the stash for the statements after it.</p>
 *
 * <pre>
 * const person = table.getItem({ key: { id: $util.dynamodb.toDynamoDB(id) } });
 * return person.Item;
 * </pre>
 *
 * compiles to one stage that stashes {@code $context.result} as {@code person}, and a
 * response template returning {@code $context.stash.person.Item}.
 */
public final class ResolverPipelineCompiler {

    private static final Logger LOG = Logger.getLogger(ResolverPipelineCompiler.class.getName());

    static final String RETURN_FLAG = "$context.stash.return__flag";
    static final String RETURN_VALUE = "$context.stash.return__val";

    private final CompilationNamespace namespace;
    private final ExternalReferences references;
    private final CompilerOptions options;

    public ResolverPipelineCompiler(CompilationNamespace namespace, ExternalReferences references, CompilerOptions options) {
        this.namespace = namespace;
        this.references = references;
        this.options = options;
    }

    public ResolverPipeline compile(FunctionDeclaration function) {
        SyntaxTree tree = SyntaxTree.of(function);
        ServiceCalls calls = new ServiceCalls(references);
        ResolverScope scope = new ResolverScope(tree, new ControlFlow(tree), function, calls,
            new ConstantFolder(references), options);

        List<Statement> statements = function.body().body();
        long serviceCalls = statements.stream().filter(s -> calls.findService(s).isPresent()).count();
        ResolverPipeline pipeline = serviceCalls == 0
            ? compileUnit(scope, statements)
            : new Assembly(scope).compile(statements);

        LOG.info(() -> "compiled resolver " + describe(function) + " with " + pipeline.stages().size()
            + " stage(s) in " + namespace.name());
        return pipeline;
    }

    private static String describe(FunctionDeclaration function) {
        return function.name() == null ? "<anonymous>" : function.name();
    }

    private ResolverPipeline compileUnit(ResolverScope scope, List<Statement> statements) {
        VtlTemplate template = new VtlTemplate(scope);
        for (int i = 0; i < statements.size(); i++) {
            Statement stmt = statements.get(i);
            if (i + 1 == statements.size()) {
                finish(template, stmt);
            } else {
                template.evalStatement(stmt);
            }
        }
        String request = "{\n"
            + "  \"version\": \"" + options.templateVersion() + "\",\n"
            + "  \"payload\": null\n"
            + "}";
        String response = template.toVtl();
        DataSource none = namespace.getDataSource(null, DataSource::none);
        return new ResolverPipeline(request, response, none, List.of(), List.of(request, response));
    }

    /**
     * Translates the statement that ends the function when no service call follows it.
     */
    private static void finish(VtlTemplate template, Statement stmt) {
        if (stmt instanceof ReturnStatement ret) {
            if (ret.argument() == null) {
                template.doReturn("$null");
            } else {
                template.doReturn(ret.argument());
            }
        } else if (stmt instanceof IfStatement) {
            template.evalStatement(stmt);
        } else {
            template.evalStatement(stmt);
            template.doReturn("$null");
        }
    }

    private DataSource createDataSource(Service service) {
        String name = namespace.getUniqueName(service.name() + "DataSource");
        if (service instanceof KeyValueStore) {
            return new DataSource(name, DataSourceKind.KEY_VALUE_STORE, service, null);
        } else if (service instanceof ComputeFunction) {
            return new DataSource(name, DataSourceKind.COMPUTE_FUNCTION, service, null);
        }
        WorkflowOrchestrator workflow = (WorkflowOrchestrator) service;
        String host = workflow.isExpress() ? "sync-states" : "states";
        return new DataSource(name, DataSourceKind.HTTP, service,
            "https://" + host + "." + options.region() + ".amazonaws.com/");
    }

    /**
     * Unwraps the HTTP response of a workflow start into {@code $sfn__result}.
     */
    static String workflowPreamble(WorkflowOrchestrator workflow, String result) {
        if (workflow.isExpress()) {
            return "#if($context.result.statusCode == 200)\n"
                + "  #set(" + result + " = $util.parseJson($context.result.body))\n"
                + "  #if(" + result + ".output == 'null')\n"
                + "    $util.qr(" + result + ".put(\"output\", $null))\n"
                + "  #else\n"
                + "    #set(" + result + ".output = $util.parseJson(" + result + ".output))\n"
                + "  #end\n"
                + "#else \n"
                + "  $util.error($context.result.body, \"$context.result.statusCode\")\n"
                + "#end";
        }
        return "#if($context.result.statusCode == 200)\n"
            + "  #set(" + result + " = $util.parseJson($context.result.body))\n"
            + "#else \n"
            + "  $util.error($context.result.body, \"$context.result.statusCode\")\n"
            + "#end";
    }

    /**
     * Accumulates templates and stages across one pipeline compilation.
     */
    private final class Assembly {

        private final ResolverScope scope;
        private final List<String> templates = new ArrayList<>();
        private final List<PipelineStage> stages = new ArrayList<>();
        private VtlTemplate template;

        Assembly(ResolverScope scope) {
            this.scope = scope;
            this.template = new VtlTemplate(scope, VtlTemplate.CIRCUIT_BREAKER);
        }

        ResolverPipeline compile(List<Statement> statements) {
            String request = "{}";
            templates.add(request);
            for (int i = 0; i < statements.size(); i++) {
                Statement stmt = statements.get(i);
                Optional<Service> service = scope.calls().findService(stmt);
                if (service.isPresent()) {
                    stages.add(stage(stmt, service.get()));
                } else if (i + 1 == statements.size()) {
                    finish(template, stmt);
                } else {
                    template.evalStatement(stmt);
                }
            }
            String response = template.toVtl();
            templates.add(response);
            return new ResolverPipeline(request, response, null, stages, templates);
        }

        private PipelineStage stage(Statement stmt, Service service) {
            DataSource dataSource = namespace.getDataSource(service, () -> createDataSource(service));
            String result = "$context.result";
            String preamble = "";
            if (service instanceof WorkflowOrchestrator workflow) {
                result = "$sfn__result";
                preamble = workflowPreamble(workflow, result) + "\n";
            }

            CallExpression call;
            String response;
            if (stmt instanceof ExpressionStatement es) {
                call = scope.calls().unwindToServiceCall(es.expression());
                template.call(call);
                response = "{}";
            } else if (stmt instanceof ReturnStatement ret && ret.argument() != null) {
                call = scope.calls().unwindToServiceCall(ret.argument());
                response = preamble
                    + "#set( " + RETURN_FLAG + " = true )\n"
                    + "#set( " + RETURN_VALUE + " = " + result(ret.argument(), call, result) + " )\n"
                    + "{}";
            } else if (stmt instanceof VariableDeclaration decl && decl.init() != null) {
                call = scope.calls().unwindToServiceCall(decl.init());
                response = preamble
                    + "#set( $context.stash." + decl.name() + " = " + result(decl.init(), call, result) + " )\n"
                    + "{}";
            } else {
                throw new CompilationException(ErrorKind.UNSUPPORTED_CALL_POSITION,
                    "only a variable declaration, an expression statement or a return may call a service", stmt);
            }

            String request = template.toVtl();
            templates.add(request);
            templates.add(response);
            template = new VtlTemplate(scope, VtlTemplate.CIRCUIT_BREAKER);

            String name = namespace.getUniqueName(ServiceCalls.nameOf(call, service));
            LOG.fine(() -> "allocated stage " + name + " on " + dataSource.name());
            return dataSource.createFunction(name, request, response);
        }

        /**
         * Renders the accesses applied to a service call's result against the
         * response's result variable, appending the call's request on the way.
         */
        private String result(Expression expr, CallExpression call, String resultName) {
            if (expr == call) {
                template.call(call);
                return resultName;
            } else if (expr instanceof MemberExpression member) {
                if (!member.computed()) {
                    return result(member.object(), call, resultName) + "." + member.propertyName();
                }
                return result(member.object(), call, resultName) + "[" + inlined(member.property()) + "]";
            } else if (expr instanceof CallExpression method && method.callee() instanceof MemberExpression callee
                && !callee.computed()) {
                List<String> args = new ArrayList<>();
                for (Expression arg : method.arguments()) {
                    args.add(inlined(arg));
                }
                return result(callee.object(), call, resultName) + "." + callee.propertyName()
                    + "(" + String.join(", ", args) + ")";
            }
            throw new CompilationException(ErrorKind.UNSUPPORTED_CALL_POSITION,
                "invalid expression in-lined with a service call: " + expr.type(), expr);
        }

        /**
         * Values used next to a call's result must not need directives of their own,
         * since they are rendered into the response template.
         */
        private String inlined(Expression expr) {
            Optional<Constant> constant = scope.folder().evalToConstant(expr);
            if (constant.isPresent() && constant.get().isPrimitive()) {
                return template.eval(expr);
            } else if (expr instanceof Identifier) {
                return template.eval(expr);
            }
            throw new CompilationException(ErrorKind.UNSUPPORTED_CALL_POSITION,
                "only constants and names can be used next to a service call's result", expr);
        }
    }
}
