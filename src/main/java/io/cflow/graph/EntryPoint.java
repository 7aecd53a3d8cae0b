package io.cflow.graph;

import io.cflow.model.Definition;

/**
 * A definition chosen as the root of a call tree.
 *
 * @param definition The root definition
 * @param reason     Why it was chosen
 */
public record EntryPoint(Definition definition, Reason reason) {

    public enum Reason {
        /** Requested by name. */
        EXPLICIT,
        /** Module-level function with the reserved entry name. */
        NAMED_MAIN,
        /** Nothing else calls it. */
        UNCALLED
    }
}
