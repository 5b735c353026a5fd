package com.jscompiler;

/**
 * Classification of a {@link CompilationException}. Every kind is fatal: compilation
 * stops at the point of detection.
 */
public enum ErrorKind {
    /** A narrowing assertion on a node's kind failed. */
    TYPE_MISMATCH,
    /** A service call appears in a statement shape that cannot be linearized into stages. */
    UNSUPPORTED_CALL_POSITION,
    /** A reference path is not rooted at an identifier the target allows. */
    INVALID_REFERENCE,
    /** A constant object has no property with the requested key. */
    PROPERTY_NOT_FOUND,
    /** A constant access used a key of the wrong type for its target. */
    INVALID_ACCESS,
    /** A spread whose operand is not a constant collection. */
    UNSUPPORTED_SPREAD,
    /** A construct reserved for one compilation target was used in another. */
    CONTEXT_MISMATCH,
    /** Map options are not an object literal with a positive integer {@code maxConcurrency}. */
    INVALID_CONCURRENCY,
    /** A parallel branch is not an inline function. */
    INVALID_BRANCH,
    /** A required terminal return statement is absent. */
    MISSING_RETURN,
    /** The target language has no rendition of this statement or expression. */
    UNSUPPORTED_SYNTAX,
    /** A recognized call form is missing an argument or received a malformed one. */
    INVALID_ARGUMENT,
    /** A callee resolves to no backend the target can invoke. */
    UNSUPPORTED_SERVICE,
    /** The input tree carries an error reported by the front end. */
    UPSTREAM_ERROR
}
