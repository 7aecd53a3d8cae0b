package io.cflow.discovery;

import io.cflow.model.ParseFailure;
import io.cflow.model.SourceFile;

import java.nio.file.Path;
import java.util.List;

/**
 * Files found under a root.
 *
 * @param root       The analyzed file or directory
 * @param files      Readable Python files, sorted by relative path
 * @param unreadable Files that matched but could not be decoded as UTF-8
 */
public record DiscoveryResult(Path root, List<SourceFile> files, List<ParseFailure> unreadable) {
    public DiscoveryResult {
        files = List.copyOf(files);
        unreadable = List.copyOf(unreadable);
    }
}
