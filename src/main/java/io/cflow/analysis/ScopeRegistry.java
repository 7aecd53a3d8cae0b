package io.cflow.analysis;

import io.cflow.model.*;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * Global name tables built from every extracted file, in file order.
 * <p>
 * Names are global: there is no import resolution, so {@code helper} defined
 * in two modules is one name. The first registration of a name wins and later
 * ones are kept only as {@link Shadowed} records.
 */
public class ScopeRegistry {
    private static final Logger log = LogManager.getLogger(ScopeRegistry.class);

    private final Map<String, Definition> moduleFunctions = new LinkedHashMap<>();
    private final Map<String, ClassDeclaration> classes = new LinkedHashMap<>();
    private final Map<String, Map<String, Definition>> methodsByClass = new LinkedHashMap<>();
    // method name -> classes defining it, in registration order
    private final Map<String, List<String>> classesByMethod = new LinkedHashMap<>();
    private final List<Definition> definitions = new ArrayList<>();
    private final List<Shadowed> shadowed = new ArrayList<>();

    /**
     * A later definition hidden by an earlier one with the same key.
     *
     * @param key      Registry key, e.g. {@code helper} or {@code Repo.save}
     * @param kept     The definition that won
     * @param shadowed The definition that was ignored for resolution
     */
    public record Shadowed(String key, Definition kept, Definition shadowed) {
    }

    /**
     * Register the classes and definitions of one file. Classes go first so
     * that methods can be attached to them.
     */
    public void register(ExtractedFile file) {
        for (ClassDeclaration declaration : file.classes()) {
            registerClass(declaration);
        }
        for (ExtractedDefinition extracted : file.definitions()) {
            registerDefinition(extracted.definition());
        }
    }

    public void registerClass(ClassDeclaration declaration) {
        ClassDeclaration existing = classes.putIfAbsent(declaration.name(), declaration);
        if (existing != null) {
            log.debug("Class {} at {} shadowed by earlier declaration at {}",
                    declaration.name(), declaration.location(), existing.location());
        }
    }

    /**
     * Register a definition under the key its kind implies. Every definition
     * becomes a graph node, even when its name is shadowed for resolution purposes.
     */
    public void registerDefinition(Definition definition) {
        switch (definition.kind()) {
            case FUNCTION -> registerModule(definition.name(), definition);
            case METHOD -> registerMethod(definition.className(), definition.name(), definition);
            case CONSTRUCTOR -> registerConstructor(definition.className(), definition);
        }
    }

    public void registerModule(String name, Definition definition) {
        definitions.add(definition);
        Definition existing = moduleFunctions.putIfAbsent(name, definition);
        if (existing != null) {
            recordShadowed(name, existing, definition);
        }
    }

    public void registerMethod(String className, String methodName, Definition definition) {
        definitions.add(definition);
        Map<String, Definition> methods = methodsByClass.computeIfAbsent(className, k -> new LinkedHashMap<>());
        Definition existing = methods.putIfAbsent(methodName, definition);
        if (existing != null) {
            recordShadowed(className + "." + methodName, existing, definition);
            return;
        }
        classesByMethod.computeIfAbsent(methodName, k -> new ArrayList<>()).add(className);
    }

    /**
     * Constructors are stored as the {@code __init__} method of their class.
     */
    public void registerConstructor(String className, Definition definition) {
        registerMethod(className, Definition.CONSTRUCTOR_NAME, definition);
    }

    private void recordShadowed(String key, Definition kept, Definition ignored) {
        shadowed.add(new Shadowed(key, kept, ignored));
        log.debug("{} at {} shadowed by {}", key, ignored.location(), kept.location());
    }

    public boolean isClass(String name) {
        return classes.containsKey(name);
    }

    public Optional<ClassDeclaration> classDeclaration(String name) {
        return Optional.ofNullable(classes.get(name));
    }

    public Optional<Definition> resolveModuleCall(String name) {
        return Optional.ofNullable(moduleFunctions.get(name));
    }

    /**
     * The method {@code name} defined directly on {@code className}, ignoring bases.
     */
    public Optional<Definition> resolveMethodCall(String className, String name) {
        Map<String, Definition> methods = methodsByClass.get(className);
        return methods == null ? Optional.empty() : Optional.ofNullable(methods.get(name));
    }

    /**
     * The {@code __init__} defined directly on {@code className}.
     */
    public Optional<Definition> resolveConstructor(String className) {
        return resolveMethodCall(className, Definition.CONSTRUCTOR_NAME);
    }

    /**
     * Classes that define a method with this name, in registration order.
     */
    public List<String> classesDefining(String methodName) {
        return Collections.unmodifiableList(classesByMethod.getOrDefault(methodName, List.of()));
    }

    /**
     * Every registered definition, shadowed ones included, in registration order.
     */
    public List<Definition> definitions() {
        return Collections.unmodifiableList(definitions);
    }

    public List<Shadowed> shadowed() {
        return Collections.unmodifiableList(shadowed);
    }

    public int classCount() {
        return classes.size();
    }
}
