package io.cflow.graph;

import io.cflow.model.Definition;

import java.util.List;

/**
 * Names that never become automatic entry points.
 * A pattern ending in {@code *} matches simple names with that prefix; any
 * other pattern matches a simple or qualified name exactly.
 */
public class EntryExclusions {
    private final List<String> patterns;

    public EntryExclusions(List<String> patterns) {
        this.patterns = patterns == null ? List.of() : List.copyOf(patterns);
    }

    public static EntryExclusions none() {
        return new EntryExclusions(List.of());
    }

    public boolean excludes(Definition definition) {
        for (String pattern : patterns) {
            if (pattern.endsWith("*")) {
                if (definition.name().startsWith(pattern.substring(0, pattern.length() - 1))) {
                    return true;
                }
            } else if (pattern.equals(definition.name()) || pattern.equals(definition.qualifiedName())) {
                return true;
            }
        }
        return false;
    }

    public List<String> patterns() {
        return patterns;
    }
}
