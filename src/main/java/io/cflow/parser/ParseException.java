package io.cflow.parser;

import java.nio.file.Path;

/**
 * Thrown when a file cannot be turned into a usable syntax tree.
 */
public class ParseException extends Exception {
    private final Path file;
    private final int line;

    public ParseException(Path file, int line, String message) {
        super(file + (line > 0 ? ":" + line : "") + ": " + message);
        this.file = file;
        this.line = line;
    }

    public ParseException(Path file, String message, Throwable cause) {
        super(file + ": " + message, cause);
        this.file = file;
        this.line = 0;
    }

    public Path getFile() {
        return file;
    }

    /**
     * 1-based line of the first syntax error, or 0 when unknown.
     */
    public int getLine() {
        return line;
    }
}
