package io.cflow.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A callable unit found in Python source: a function, a method or a constructor.
 *
 * @param name          Simple name, e.g. {@code save}
 * @param qualifiedName {@code Class.name} for methods and constructors, {@code name} otherwise
 * @param kind          What kind of callable this is
 * @param className     Owning class for methods and constructors, null for functions
 * @param parameters    Declared parameter names in order, including {@code self}
 * @param location      Where the {@code def} keyword sits
 * @param isAsync       Whether this is an {@code async def}
 */
public record Definition(
        String name,
        String qualifiedName,
        DefinitionKind kind,
        String className,
        List<String> parameters,
        SourceLocation location,
        boolean isAsync
) {
    public static final String CONSTRUCTOR_NAME = "__init__";

    public Definition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Definition name cannot be null or blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Definition kind cannot be null: " + name);
        }
        if (location == null) {
            throw new IllegalArgumentException("Definition location cannot be null: " + name);
        }
        boolean member = kind != DefinitionKind.FUNCTION;
        if (member && (className == null || className.isBlank())) {
            throw new IllegalArgumentException(kind + " '" + name + "' requires a class name");
        }
        if (!member && className != null) {
            throw new IllegalArgumentException("Function '" + name + "' cannot have a class name");
        }
        if (kind == DefinitionKind.CONSTRUCTOR && !CONSTRUCTOR_NAME.equals(name)) {
            throw new IllegalArgumentException("Constructor must be named " + CONSTRUCTOR_NAME + ", got " + name);
        }
        String expected = member ? className + "." + name : name;
        if (qualifiedName == null) {
            qualifiedName = expected;
        } else if (!qualifiedName.equals(expected)) {
            throw new IllegalArgumentException("Qualified name " + qualifiedName + " does not match " + expected);
        }
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    /**
     * Identity of this definition in the graph.
     */
    public DefinitionId id() {
        return new DefinitionId(qualifiedName, location.file(), location.line());
    }

    /**
     * Methods and constructors both receive {@code self}.
     */
    public boolean isMember() {
        return kind != DefinitionKind.FUNCTION;
    }

    public boolean isConstructor() {
        return kind == DefinitionKind.CONSTRUCTOR;
    }

    /**
     * Label used in trees and diagrams, with the file position appended.
     */
    public String displayName() {
        return qualifiedName + " (" + location.shortForm() + ")";
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for definitions, mostly used while walking a syntax tree.
     */
    public static class Builder {
        private String name;
        private DefinitionKind kind = DefinitionKind.FUNCTION;
        private String className;
        private final List<String> parameters = new ArrayList<>();
        private SourceLocation location;
        private boolean isAsync;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        /**
         * Marks the definition as a member of the given class; {@code __init__}
         * becomes a constructor, anything else a method.
         */
        public Builder memberOf(String className) {
            this.className = className;
            this.kind = null;
            return this;
        }

        public Builder parameter(String parameter) {
            this.parameters.add(parameter);
            return this;
        }

        public Builder parameters(List<String> parameters) {
            this.parameters.addAll(parameters);
            return this;
        }

        public Builder location(SourceLocation location) {
            this.location = location;
            return this;
        }

        public Builder isAsync(boolean isAsync) {
            this.isAsync = isAsync;
            return this;
        }

        public Definition build() {
            DefinitionKind resolvedKind = kind;
            if (resolvedKind == null) {
                resolvedKind = CONSTRUCTOR_NAME.equals(name) ? DefinitionKind.CONSTRUCTOR : DefinitionKind.METHOD;
            }
            return new Definition(name, null, resolvedKind, className, parameters, location, isAsync);
        }
    }
}
