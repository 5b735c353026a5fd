package com.jscompiler.jackson;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.jscompiler.asl.CatchRule;
import com.jscompiler.asl.ChoiceState;
import com.jscompiler.asl.FailState;
import com.jscompiler.asl.JsonNull;
import com.jscompiler.asl.MapState;
import com.jscompiler.asl.ParallelState;
import com.jscompiler.asl.PassState;
import com.jscompiler.asl.ResultPath;
import com.jscompiler.asl.State;
import com.jscompiler.asl.StateMachine;
import com.jscompiler.asl.SucceedState;
import com.jscompiler.asl.TaskState;
import com.jscompiler.asl.WaitState;
import com.jscompiler.ast.*;

import java.io.IOException;
import java.util.List;

/**
 * Jackson module that configures serialization/deserialization for the AST classes
 * and the compiled state machines.
 *
 * This module handles:
 * - Polymorphic node types via the "type" property
 * - Null literals, which are serialized even though the mapper excludes nulls
 * - JavaScript-compatible number serialization
 * - The orchestrator's definition format for states: upper camel case keys, a "Type"
 *   discriminator, and explicit nulls for discarded results
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.jscompiler", "counterpoint-jackson"));
        addSerializer(ResultPath.class, new ResultPathSerializer());
        addSerializer(JsonNull.class, new JsonNullSerializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        // Register polymorphic type handling
        context.setMixInAnnotations(Node.class, NodeMixin.class);
        context.setMixInAnnotations(Statement.class, NodeMixin.class);
        context.setMixInAnnotations(Expression.class, NodeMixin.class);
        context.setMixInAnnotations(Declaration.class, NodeMixin.class);

        // Records exposing derived boolean accessors that must not become properties
        context.setMixInAnnotations(Literal.class, LiteralMixin.class);
        context.setMixInAnnotations(BlockStatement.class, BlockStatementMixin.class);

        context.setMixInAnnotations(StateMachine.class, StateMachineMixin.class);
        context.setMixInAnnotations(State.class, StateMixin.class);
        context.setMixInAnnotations(TaskState.class, CatchingStateMixin.class);
        context.setMixInAnnotations(MapState.class, CatchingStateMixin.class);
        context.setMixInAnnotations(ParallelState.class, CatchingStateMixin.class);
        context.setMixInAnnotations(PassState.class, StateFieldsMixin.class);
        context.setMixInAnnotations(WaitState.class, StateFieldsMixin.class);
        context.setMixInAnnotations(FailState.class, StateFieldsMixin.class);
        context.setMixInAnnotations(SucceedState.class, StateFieldsMixin.class);
        context.setMixInAnnotations(ChoiceState.class, ChoiceStateMixin.class);
        context.setMixInAnnotations(CatchRule.class, StateFieldsMixin.class);
    }

    // ==================== AST Mixins ====================

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
    @JsonSubTypes({
        @JsonSubTypes.Type(value = ArrayExpression.class, name = "ArrayExpression"),
        @JsonSubTypes.Type(value = ArrowFunctionExpression.class, name = "ArrowFunctionExpression"),
        @JsonSubTypes.Type(value = AssignmentExpression.class, name = "AssignmentExpression"),
        @JsonSubTypes.Type(value = BinaryExpression.class, name = "BinaryExpression"),
        @JsonSubTypes.Type(value = BlockStatement.class, name = "BlockStatement"),
        @JsonSubTypes.Type(value = BreakStatement.class, name = "BreakStatement"),
        @JsonSubTypes.Type(value = CallExpression.class, name = "CallExpression"),
        @JsonSubTypes.Type(value = CatchClause.class, name = "CatchClause"),
        @JsonSubTypes.Type(value = ConditionalExpression.class, name = "ConditionalExpression"),
        @JsonSubTypes.Type(value = ContinueStatement.class, name = "ContinueStatement"),
        @JsonSubTypes.Type(value = DoWhileStatement.class, name = "DoWhileStatement"),
        @JsonSubTypes.Type(value = EmptyStatement.class, name = "EmptyStatement"),
        @JsonSubTypes.Type(value = ExpressionStatement.class, name = "ExpressionStatement"),
        @JsonSubTypes.Type(value = ForInStatement.class, name = "ForInStatement"),
        @JsonSubTypes.Type(value = ForOfStatement.class, name = "ForOfStatement"),
        @JsonSubTypes.Type(value = FunctionDeclaration.class, name = "FunctionDeclaration"),
        @JsonSubTypes.Type(value = Identifier.class, name = "Identifier"),
        @JsonSubTypes.Type(value = IfStatement.class, name = "IfStatement"),
        @JsonSubTypes.Type(value = Literal.class, name = "Literal"),
        @JsonSubTypes.Type(value = LogicalExpression.class, name = "LogicalExpression"),
        @JsonSubTypes.Type(value = MemberExpression.class, name = "MemberExpression"),
        @JsonSubTypes.Type(value = NewExpression.class, name = "NewExpression"),
        @JsonSubTypes.Type(value = ObjectExpression.class, name = "ObjectExpression"),
        @JsonSubTypes.Type(value = Parameter.class, name = "Parameter"),
        @JsonSubTypes.Type(value = Property.class, name = "Property"),
        @JsonSubTypes.Type(value = ReferenceExpression.class, name = "ReferenceExpression"),
        @JsonSubTypes.Type(value = ReturnStatement.class, name = "ReturnStatement"),
        @JsonSubTypes.Type(value = SpreadElement.class, name = "SpreadElement"),
        @JsonSubTypes.Type(value = TemplateLiteral.class, name = "TemplateLiteral"),
        @JsonSubTypes.Type(value = ThrowStatement.class, name = "ThrowStatement"),
        @JsonSubTypes.Type(value = TryStatement.class, name = "TryStatement"),
        @JsonSubTypes.Type(value = UnaryExpression.class, name = "UnaryExpression"),
        @JsonSubTypes.Type(value = VariableDeclaration.class, name = "VariableDeclaration"),
        @JsonSubTypes.Type(value = WhileStatement.class, name = "WhileStatement"),
        @JsonSubTypes.Type(value = ErrorNode.class, name = "Err")
    })
    @JsonIgnoreProperties(value = {"nodeKind"}, ignoreUnknown = true)
    private abstract static class NodeMixin {
    }

    @JsonIgnoreProperties({"string", "number"})
    private abstract static class LiteralMixin {
        @JsonSerialize(using = JavaScriptNumberSerializer.class)
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Object value();
    }

    @JsonIgnoreProperties({"empty"})
    private abstract static class BlockStatementMixin {
    }

    // ==================== State Machine Mixins ====================

    @JsonNaming(PropertyNamingStrategies.UpperCamelCaseStrategy.class)
    private abstract static class StateMachineMixin {
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "Type")
    @JsonSubTypes({
        @JsonSubTypes.Type(value = TaskState.class, name = "Task"),
        @JsonSubTypes.Type(value = WaitState.class, name = "Wait"),
        @JsonSubTypes.Type(value = MapState.class, name = "Map"),
        @JsonSubTypes.Type(value = ParallelState.class, name = "Parallel"),
        @JsonSubTypes.Type(value = PassState.class, name = "Pass"),
        @JsonSubTypes.Type(value = ChoiceState.class, name = "Choice"),
        @JsonSubTypes.Type(value = SucceedState.class, name = "Succeed"),
        @JsonSubTypes.Type(value = FailState.class, name = "Fail")
    })
    private abstract static class StateMixin {
    }

    @JsonNaming(PropertyNamingStrategies.UpperCamelCaseStrategy.class)
    private abstract static class StateFieldsMixin {
    }

    @JsonNaming(PropertyNamingStrategies.UpperCamelCaseStrategy.class)
    private abstract static class CatchingStateMixin {
        @JsonProperty("Catch")
        abstract List<CatchRule> catchRules();
    }

    @JsonNaming(PropertyNamingStrategies.UpperCamelCaseStrategy.class)
    private abstract static class ChoiceStateMixin {
        @JsonProperty("Default")
        abstract String defaultState();
    }

    // ==================== Serializers ====================

    // A discarded result is an explicit null, which the mapper's NON_NULL inclusion keeps
    private static class ResultPathSerializer extends JsonSerializer<ResultPath> {
        @Override
        public void serialize(ResultPath value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            if (value.isDiscard()) {
                gen.writeNull();
            } else {
                gen.writeString(value.path());
            }
        }
    }

    private static class JsonNullSerializer extends JsonSerializer<JsonNull> {
        @Override
        public void serialize(JsonNull value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeNull();
        }
    }
}
