package io.cflow.model;

import java.nio.file.Path;

/**
 * A file that could not be analyzed. The run continues without it.
 *
 * @param file   The file
 * @param reason Human-readable cause
 */
public record ParseFailure(Path file, String reason) {

    @Override
    public String toString() {
        return file + ": " + reason;
    }
}
