package io.cflow.discovery;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;

/**
 * A glob over '/'-separated relative paths. {@code *} and {@code ?} stay inside
 * one path segment, {@code **} crosses segments, and a leading {@code **}{@code /}
 * also matches at the root.
 */
final class GlobPattern {

    private static final String ANY_DIRECTORIES = "**/";

    private final String glob;
    private final PathMatcher matcher;
    private final PathMatcher rootMatcher;

    private GlobPattern(String glob) {
        this.glob = glob;
        this.matcher = FileSystems.getDefault().getPathMatcher("glob:" + glob);
        this.rootMatcher = glob.startsWith(ANY_DIRECTORIES)
                ? FileSystems.getDefault().getPathMatcher("glob:" + glob.substring(ANY_DIRECTORIES.length()))
                : null;
    }

    /**
     * @throws java.util.regex.PatternSyntaxException if the glob is malformed
     */
    static GlobPattern compile(String glob) {
        return new GlobPattern(glob);
    }

    boolean matches(String relativePath) {
        Path path = Path.of(relativePath);
        return matcher.matches(path) || (rootMatcher != null && rootMatcher.matches(path));
    }

    @Override
    public String toString() {
        return glob;
    }
}
