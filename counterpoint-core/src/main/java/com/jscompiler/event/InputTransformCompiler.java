package com.jscompiler.event;

import com.jscompiler.CompilationException;
import com.jscompiler.ErrorKind;
import com.jscompiler.ast.ArrayExpression;
import com.jscompiler.ast.Expression;
import com.jscompiler.ast.FunctionDeclaration;
import com.jscompiler.ast.Identifier;
import com.jscompiler.ast.MemberExpression;
import com.jscompiler.ast.ObjectExpression;
import com.jscompiler.ast.Property;
import com.jscompiler.ast.TemplateLiteral;
import com.jscompiler.fold.Constant;
import com.jscompiler.fold.ConstantFolder;
import com.jscompiler.fold.EventReferences;
import com.jscompiler.fold.ExpressionFlattener;
import com.jscompiler.fold.ReferencePath;
import com.jscompiler.fold.Undefined;
import com.jscompiler.service.ExternalReferences;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Compiles a target-input function {@code (event, $utils) => ...} into the input of an
 * event rule's target.
 *
 * <pre>
 * (event) => {
 *   const name = event.detail.name;
 *   return { greeting: `hello ${name}`, source: event.source };
 * }
 * </pre>
 *
 * compiles to the input paths {@code detail_name -> $.detail.name} and
 * {@code source -> $.source} with the template
 * {@code {"greeting": "hello <detail_name>", "source": <source>}}.
 */
public final class InputTransformCompiler {

    private static final Logger LOG = Logger.getLogger(InputTransformCompiler.class.getName());

    /** Rule variables the target input can reference as {@code $utils.context.*}. */
    static final Map<String, String> CONTEXT_PLACEHOLDERS = Map.of(
        "ruleArn", "aws.events.rule-arn",
        "ruleName", "aws.events.rule-name",
        "eventJson", "aws.events.event.json",
        "ingestionTime", "aws.events.event.ingestion-time");

    private final ConstantFolder folder;
    private final ExpressionFlattener flattener;

    public InputTransformCompiler(ExternalReferences references) {
        this.folder = new ConstantFolder(references);
        this.flattener = new ExpressionFlattener(folder);
    }

    public InputTransform compile(FunctionDeclaration function) {
        if (function.params().isEmpty()) {
            throw new CompilationException(ErrorKind.INVALID_ARGUMENT,
                "a target input function must declare the event parameter", function);
        }
        String eventName = function.params().get(0).name();
        String utilsName = function.params().size() > 1 ? function.params().get(1).name() : null;
        Expression result = flattener.flattenReturnEvent(function.body().body());

        Rendering rendering = new Rendering(eventName, utilsName);
        String template = rendering.render(result);
        if (rendering.paths.isEmpty() && rendering.context.isEmpty()) {
            LOG.fine(() -> "target input is constant");
            return InputTransform.constant(template);
        }
        LOG.fine(() -> "target input references " + rendering.paths.keySet());
        return new InputTransform(null, rendering.paths, template);
    }

    /**
     * Renders one input template, collecting the paths its placeholders stand for.
     */
    private final class Rendering {

        private final String eventName;
        private final String utilsName;
        private final Map<String, String> paths = new LinkedHashMap<>();
        private final Map<String, String> placeholders = new LinkedHashMap<>();
        private final Set<String> context = new HashSet<>();

        Rendering(String eventName, String utilsName) {
            this.eventName = eventName;
            this.utilsName = utilsName;
        }

        String render(Expression expr) {
            Optional<Constant> constant = folder.evalToConstant(expr).filter(Constant::isPrimitive);
            if (constant.isPresent()) {
                Object value = constant.get().value();
                if (value == Undefined.VALUE || value == null) {
                    return "null";
                }
                return value instanceof String s ? quote(s) : constant.get().asString();
            } else if (expr instanceof Identifier || expr instanceof MemberExpression) {
                return "<" + placeholder(expr) + ">";
            } else if (expr instanceof ObjectExpression object) {
                List<String> entries = new ArrayList<>();
                for (Expression member : object.properties()) {
                    Property property = (Property) member;
                    if (isUndefined(property.value())) {
                        continue;
                    }
                    entries.add(quote(property.staticKey()) + ": " + render(property.value()));
                }
                return "{" + String.join(", ", entries) + "}";
            } else if (expr instanceof ArrayExpression array) {
                List<String> elements = new ArrayList<>();
                for (Expression element : array.elements()) {
                    elements.add(render(element));
                }
                return "[" + String.join(", ", elements) + "]";
            } else if (expr instanceof TemplateLiteral template) {
                StringBuilder out = new StringBuilder("\"");
                for (Expression part : template.parts()) {
                    Optional<Constant> text = folder.evalToConstant(part).filter(Constant::isPrimitive);
                    if (text.isPresent()) {
                        out.append(escape(text.get().asString()));
                    } else if (part instanceof Identifier || part instanceof MemberExpression) {
                        out.append('<').append(placeholder(part)).append('>');
                    } else {
                        throw unsupported(part);
                    }
                }
                return out.append('"').toString();
            }
            throw unsupported(expr);
        }

        private boolean isUndefined(Expression expr) {
            return folder.evalToConstant(expr).map(c -> c.value() == Undefined.VALUE).orElse(false);
        }

        private String placeholder(Expression expr) {
            ReferencePath path = flattener.getReferencePath(expr).orElse(null);
            EventReferences.assertValidEventReference(path, eventName, utilsName);
            if (path.identity().equals(eventName)) {
                return eventPlaceholder(path);
            }
            if (path.depth() != 2 || !"context".equals(path.reference().get(0))
                || !CONTEXT_PLACEHOLDERS.containsKey(String.valueOf(path.reference().get(1)))) {
                throw new CompilationException(ErrorKind.INVALID_REFERENCE,
                    "only " + utilsName + ".context." + CONTEXT_PLACEHOLDERS.keySet() + " can be referenced", expr);
            }
            String name = CONTEXT_PLACEHOLDERS.get(String.valueOf(path.reference().get(1)));
            context.add(name);
            return name;
        }

        private String eventPlaceholder(ReferencePath path) {
            StringBuilder jsonPath = new StringBuilder("$");
            List<String> parts = new ArrayList<>();
            for (Object key : path.reference()) {
                if (key instanceof Number) {
                    jsonPath.append('[').append(key).append(']');
                } else {
                    jsonPath.append('.').append(key);
                }
                parts.add(String.valueOf(key).replaceAll("[^A-Za-z0-9_]", "_"));
            }
            String existing = placeholders.get(jsonPath.toString());
            if (existing != null) {
                return existing;
            }
            String base = parts.isEmpty() ? eventName : String.join("_", parts);
            String name = base;
            for (int i = 1; paths.containsKey(name); i++) {
                name = base + "_" + i;
            }
            paths.put(name, jsonPath.toString());
            placeholders.put(jsonPath.toString(), name);
            return name;
        }

        private CompilationException unsupported(Expression expr) {
            return new CompilationException(ErrorKind.UNSUPPORTED_SYNTAX,
                expr.type() + " cannot be rendered into a target input", expr);
        }
    }

    private static String quote(String text) {
        return "\"" + escape(text) + "\"";
    }

    private static String escape(String text) {
        StringBuilder out = new StringBuilder();
        for (char c : text.toCharArray()) {
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> {
                    if (c < 0x20) {
                        out.append(String.format("\\u%04x", (int) c));
                    } else {
                        out.append(c);
                    }
                }
            }
        }
        return out.toString();
    }
}
