package com.jscompiler;

import com.jscompiler.ast.Node;

/**
 * Thrown when a function body cannot be compiled. The message is meant to be shown
 * verbatim to whoever wrote the input source.
 */
public class CompilationException extends RuntimeException {

    private final ErrorKind kind;
    private final transient Node node;

    public CompilationException(ErrorKind kind, String message) {
        this(kind, message, null);
    }

    public CompilationException(ErrorKind kind, String message, Node node) {
        super(describe(message, node));
        this.kind = kind;
        this.node = node;
    }

    public ErrorKind kind() {
        return kind;
    }

    /**
     * @return the offending node, or null when the failure has no single location
     */
    public Node node() {
        return node;
    }

    private static String describe(String message, Node node) {
        if (node == null) {
            return message;
        }
        if (node.start() == 0 && node.end() == 0) {
            return message + " (at " + node.type() + ")";
        }
        return message + " (at " + node.type() + " " + node.start() + ".." + node.end() + ")";
    }
}
