package io.cflow.analysis;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Variables known to hold an instance of a class, within one definition body.
 * Bindings are flow-insensitive to branches: the last assignment seen in
 * source order wins.
 */
public class VariableBindings {
    private final Map<String, String> classByVariable = new HashMap<>();

    public void bind(String variable, String className) {
        classByVariable.put(variable, className);
    }

    public void clear(String variable) {
        classByVariable.remove(variable);
    }

    public Optional<String> classOf(String variable) {
        return Optional.ofNullable(classByVariable.get(variable));
    }

    public int size() {
        return classByVariable.size();
    }
}
