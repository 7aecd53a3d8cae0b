package io.cflow.model;

import java.nio.file.Path;

/**
 * Position inside a source file.
 *
 * @param file   The file
 * @param line   1-based line number
 * @param column 1-based column number
 */
public record SourceLocation(Path file, int line, int column) {
    public SourceLocation {
        if (file == null) {
            throw new IllegalArgumentException("Location file cannot be null");
        }
        if (line < 1) {
            throw new IllegalArgumentException("Line must be >= 1, got " + line);
        }
        if (column < 1) {
            throw new IllegalArgumentException("Column must be >= 1, got " + column);
        }
    }

    /**
     * Short form used in reports, e.g. {@code app.py:12}.
     */
    public String shortForm() {
        return file.getFileName() + ":" + line;
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
