package com.jscompiler;

import com.jscompiler.asl.StateMachine;
import com.jscompiler.asl.StateMachineCompiler;
import com.jscompiler.ast.ErrorNode;
import com.jscompiler.ast.FunctionDeclaration;
import com.jscompiler.ast.Node;
import com.jscompiler.event.InputTransform;
import com.jscompiler.event.InputTransformCompiler;
import com.jscompiler.service.CompilationNamespace;
import com.jscompiler.service.ExternalReferences;
import com.jscompiler.vtl.ResolverPipeline;
import com.jscompiler.vtl.ResolverPipelineCompiler;

/**
 * Entry point for compiling functions handed over by the front end. Resolvers compiled
 * through one instance share a {@link CompilationNamespace}, so their stage and data
 * source names never collide.
 *
 * <pre>
 * Compiler compiler = new Compiler("api", ExternalReferences.of(Map.of("table", table)));
 * ResolverPipeline resolver = compiler.compileResolver(function);
 * </pre>
 */
public final class Compiler {

    private final CompilationNamespace namespace;
    private final ExternalReferences references;
    private final CompilerOptions options;

    public Compiler(String namespace, ExternalReferences references) {
        this(namespace, references, CompilerOptions.fromEnvironment());
    }

    public Compiler(String namespace, ExternalReferences references, CompilerOptions options) {
        this.namespace = new CompilationNamespace(namespace);
        this.references = references;
        this.options = options;
    }

    public CompilationNamespace namespace() {
        return namespace;
    }

    public ResolverPipeline compileResolver(Node root) {
        return new ResolverPipelineCompiler(namespace, references, options).compile(function(root));
    }

    public StateMachine compileStateMachine(Node root) {
        return new StateMachineCompiler(references, options).compile(function(root));
    }

    public InputTransform compileTargetInput(Node root) {
        return new InputTransformCompiler(references).compile(function(root));
    }

    /**
     * @throws CompilationException of kind {@link ErrorKind#UPSTREAM_ERROR} when the
     *                              front end could not produce the function
     */
    static FunctionDeclaration function(Node root) {
        if (root instanceof ErrorNode error) {
            throw new CompilationException(ErrorKind.UPSTREAM_ERROR, error.message(), error);
        } else if (root instanceof FunctionDeclaration function) {
            return function;
        }
        throw new CompilationException(ErrorKind.INVALID_ARGUMENT,
            "expected a function, found " + (root == null ? "nothing" : root.type()), root);
    }
}
