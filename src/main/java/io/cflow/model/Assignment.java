package io.cflow.model;

/**
 * A binding of a simple or dotted name inside a definition body. Besides plain
 * assignments this covers loop variables, {@code with}/{@code except} aliases,
 * {@code :=} and augmented assignments.
 *
 * @param target               Assigned name, e.g. {@code repo} or {@code self.repo}
 * @param constructorCandidate Bare callee name when the value is {@code Name(...)}, otherwise null
 * @param offset               Byte offset from which the new binding holds
 */
public record Assignment(String target, String constructorCandidate, int offset) implements BodyEvent {
    public Assignment {
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("Assignment target cannot be null or blank");
        }
    }

    /**
     * Whether the assigned value could be a class instantiation.
     */
    public boolean hasConstructorCandidate() {
        return constructorCandidate != null;
    }
}
