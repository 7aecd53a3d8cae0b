package io.cflow.model;

import java.nio.file.Path;

/**
 * A Python source file handed to the analyzer.
 *
 * @param path Path of the file, relative to the analyzed root where possible
 * @param text Full decoded text of the file
 */
public record SourceFile(Path path, String text) {
    public SourceFile {
        if (path == null) {
            throw new IllegalArgumentException("Source path cannot be null");
        }
        if (text == null) {
            throw new IllegalArgumentException("Source text cannot be null: " + path);
        }
    }

    /**
     * File name without directories, as shown next to tree nodes.
     */
    public String fileName() {
        return path.getFileName().toString();
    }
}
