package com.jscompiler.vtl;

import com.jscompiler.CompilerOptions;
import com.jscompiler.ast.FunctionDeclaration;
import com.jscompiler.ast.SyntaxTree;
import com.jscompiler.flow.ControlFlow;
import com.jscompiler.fold.ConstantFolder;
import com.jscompiler.service.ServiceCalls;

/**
 * What every template of one resolver compilation shares.
 */
record ResolverScope(
    SyntaxTree tree,
    ControlFlow flow,
    FunctionDeclaration function,
    ServiceCalls calls,
    ConstantFolder folder,
    CompilerOptions options
) {
}
