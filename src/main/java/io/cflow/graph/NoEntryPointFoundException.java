package io.cflow.graph;

/**
 * Thrown when an explicitly requested entry point matches no definition.
 */
public class NoEntryPointFoundException extends Exception {
    private final String requestedName;

    public NoEntryPointFoundException(String requestedName) {
        super("Entry point '" + requestedName + "' not found");
        this.requestedName = requestedName;
    }

    public String getRequestedName() {
        return requestedName;
    }
}
