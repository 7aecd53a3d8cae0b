package io.cflow.model;

import java.nio.file.Path;

/**
 * Identity of a definition: two definitions with the same qualified name
 * in the same file on the same line are the same node.
 */
public record DefinitionId(String qualifiedName, Path file, int line) {

    /**
     * Returns a unique key string for this definition.
     */
    public String key() {
        return file + "#" + qualifiedName + "@" + line;
    }
}
