package io.cflow.model;

/**
 * Kind of callable definition.
 */
public enum DefinitionKind {
    /** Module-level function, including functions nested in other functions. */
    FUNCTION,
    /** Function defined directly in a class body. */
    METHOD,
    /** The {@code __init__} method of a class. */
    CONSTRUCTOR
}
