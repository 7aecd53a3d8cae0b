package io.cflow.discovery;

import io.cflow.model.ParseFailure;
import io.cflow.model.SourceFile;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.*;

/**
 * Finds the Python files to analyze under a file or directory.
 * <p>
 * Hidden entries, well-known tool and virtualenv directories, configured
 * directories and glob patterns, and entries ignored by the root
 * {@code .gitignore} are skipped. The result is sorted by relative path so
 * that runs are reproducible.
 */
public class SourceDiscovery {
    private static final Logger log = LogManager.getLogger(SourceDiscovery.class);

    public static final Set<String> DEFAULT_EXCLUDED_DIRS = Set.of(
            ".git", ".svn", ".hg", "__pycache__", ".venv", "venv", ".env", "env",
            ".tox", ".nox", ".mypy_cache", ".pytest_cache", ".ruff_cache", "dist", "build");

    private static final String PYTHON_EXTENSION = ".py";

    private final Set<String> excludedDirs;
    private final List<GlobPattern> excludePatterns;
    private final boolean useGitignore;

    public SourceDiscovery() {
        this(Set.of(), List.of(), true);
    }

    /**
     * @param extraExcludedDirs directory names skipped in addition to the defaults
     * @param excludeGlobs      globs over relative paths, e.g. {@code **}{@code /test_*.py}
     * @param useGitignore      whether to honor the root {@code .gitignore}
     */
    public SourceDiscovery(Set<String> extraExcludedDirs, List<String> excludeGlobs, boolean useGitignore) {
        Set<String> dirs = new HashSet<>(DEFAULT_EXCLUDED_DIRS);
        dirs.addAll(extraExcludedDirs);
        this.excludedDirs = Collections.unmodifiableSet(dirs);
        this.excludePatterns = excludeGlobs.stream().map(GlobPattern::compile).toList();
        this.useGitignore = useGitignore;
    }

    /**
     * Discover and read the Python files under {@code root}.
     *
     * @throws NoSuchFileException if the root does not exist
     * @throws IOException         if a directory cannot be listed
     */
    public DiscoveryResult discover(Path root) throws IOException {
        if (!Files.exists(root)) {
            throw new NoSuchFileException(root.toString(), null, "path does not exist");
        }
        List<SourceFile> files = new ArrayList<>();
        List<ParseFailure> unreadable = new ArrayList<>();

        if (Files.isRegularFile(root)) {
            if (isPythonFile(root)) {
                read(root, root, files, unreadable);
            }
            return new DiscoveryResult(root, files, unreadable);
        }

        IgnoreRules ignoreRules = useGitignore ? IgnoreRules.load(root) : IgnoreRules.empty();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (dir.equals(root)) {
                    return FileVisitResult.CONTINUE;
                }
                String name = dir.getFileName().toString();
                String relative = relativePath(root, dir);
                if (name.startsWith(".") || excludedDirs.contains(name) || ignoreRules.isIgnored(relative, true)) {
                    log.debug("Skipping directory {}", relative);
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                String relative = relativePath(root, file);
                if (attrs.isRegularFile()
                        && isPythonFile(file)
                        && !file.getFileName().toString().startsWith(".")
                        && !ignoreRules.isIgnored(relative, false)
                        && !isExcluded(relative)) {
                    read(root.relativize(file), file, files, unreadable);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException e) {
                log.warn("Cannot access {}: {}", file, e.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });

        files.sort(Comparator.comparing(f -> separatorsToSlash(f.path())));
        log.debug("Discovered {} Python files under {}", files.size(), root);
        return new DiscoveryResult(root, files, unreadable);
    }

    private void read(Path displayPath, Path file, List<SourceFile> files, List<ParseFailure> unreadable) {
        try {
            files.add(new SourceFile(displayPath, Files.readString(file, StandardCharsets.UTF_8)));
        } catch (CharacterCodingException e) {
            log.warn("Skipping {}: not valid UTF-8", displayPath);
            unreadable.add(new ParseFailure(displayPath, "not valid UTF-8"));
        } catch (IOException e) {
            log.warn("Skipping {}: {}", displayPath, e.getMessage());
            unreadable.add(new ParseFailure(displayPath, "unreadable: " + e.getMessage()));
        }
    }

    private boolean isExcluded(String relativePath) {
        for (GlobPattern pattern : excludePatterns) {
            if (pattern.matches(relativePath)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isPythonFile(Path file) {
        return file.getFileName().toString().endsWith(PYTHON_EXTENSION);
    }

    private static String relativePath(Path root, Path entry) {
        return separatorsToSlash(root.relativize(entry));
    }

    private static String separatorsToSlash(Path path) {
        return path.toString().replace('\\', '/');
    }
}
