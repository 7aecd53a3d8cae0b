package io.cflow.model;

/**
 * Something that happens inside a definition body at a given byte offset.
 * Resolution replays these in offset order so that variable bindings are
 * visible only to calls that come after them.
 */
public sealed interface BodyEvent permits CallSite, Assignment {

    /**
     * Byte offset in the file at which the event takes effect.
     */
    int offset();
}
