package io.cflow.model;

/**
 * Syntactic shape of the callee expression at a call site.
 */
public enum CallForm {
    /** {@code name(...)} */
    BARE,
    /** {@code receiver.method(...)} */
    ATTRIBUTE,
    /** Anything else: subscripts, calls on call results, lambdas. Never resolved. */
    OTHER
}
