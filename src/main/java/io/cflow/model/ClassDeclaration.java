package io.cflow.model;

import java.util.List;

/**
 * A class statement.
 *
 * @param name     Class name
 * @param bases    Simple names of the listed base classes, in declaration order
 * @param location Where the {@code class} keyword sits
 */
public record ClassDeclaration(String name, List<String> bases, SourceLocation location) {
    public ClassDeclaration {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Class name cannot be null or blank");
        }
        bases = bases == null ? List.of() : List.copyOf(bases);
    }
}
