package io.cflow;

import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Optional settings loaded from a YAML file, by default {@code cflow.yaml} in
 * the analyzed directory. Every key is optional; command line flags take
 * precedence over the values found here.
 * <pre>
 * entry: main
 * maxDepth: 10
 * entryName: main
 * excludeDirs: [migrations]
 * excludePatterns: ["**&#47;test_*.py"]
 * entryExclusions: ["_*", "test_*"]
 * parallelism: 4
 * withMermaid: false
 * mermaidMaxNodes: 50
 * respectGitignore: true
 * </pre>
 */
public class CflowConfig {
    public static final String DEFAULT_FILE_NAME = "cflow.yaml";

    private final String entry;
    private final Integer maxDepth;
    private final String entryName;
    private final Set<String> excludeDirs;
    private final List<String> excludePatterns;
    private final List<String> entryExclusions;
    private final Integer parallelism;
    private final Boolean withMermaid;
    private final Integer mermaidMaxNodes;
    private final Boolean respectGitignore;

    private CflowConfig(String entry,
                        Integer maxDepth,
                        String entryName,
                        Set<String> excludeDirs,
                        List<String> excludePatterns,
                        List<String> entryExclusions,
                        Integer parallelism,
                        Boolean withMermaid,
                        Integer mermaidMaxNodes,
                        Boolean respectGitignore) {
        this.entry = entry;
        this.maxDepth = maxDepth;
        this.entryName = entryName;
        this.excludeDirs = excludeDirs;
        this.excludePatterns = excludePatterns;
        this.entryExclusions = entryExclusions;
        this.parallelism = parallelism;
        this.withMermaid = withMermaid;
        this.mermaidMaxNodes = mermaidMaxNodes;
        this.respectGitignore = respectGitignore;
    }

    /**
     * Configuration with nothing set.
     */
    public static CflowConfig empty() {
        return new CflowConfig(null, null, null, Set.of(), List.of(), List.of(), null, null, null, null);
    }

    /**
     * Load configuration from a YAML file.
     *
     * @throws IOException if the file cannot be read, is not a YAML mapping, or holds invalid values
     */
    public static CflowConfig load(Path configPath) throws IOException {
        Yaml yaml = new Yaml();

        Object loaded;
        try (InputStream in = Files.newInputStream(configPath)) {
            loaded = yaml.load(in);
        } catch (YAMLException e) {
            throw new IOException("Invalid YAML in " + configPath + ": " + e.getMessage(), e);
        }
        if (loaded == null) {
            return empty();
        }
        if (!(loaded instanceof Map<?, ?> data)) {
            throw new IOException("Config file must contain a mapping: " + configPath);
        }

        Integer maxDepth = integer(data, "maxDepth", configPath);
        if (maxDepth != null && maxDepth < 0) {
            throw new IOException("'maxDepth' must be >= 0 in " + configPath);
        }
        Integer parallelism = integer(data, "parallelism", configPath);
        if (parallelism != null && parallelism < 1) {
            throw new IOException("'parallelism' must be >= 1 in " + configPath);
        }
        Integer mermaidMaxNodes = integer(data, "mermaidMaxNodes", configPath);
        if (mermaidMaxNodes != null && mermaidMaxNodes < 1) {
            throw new IOException("'mermaidMaxNodes' must be >= 1 in " + configPath);
        }

        return new CflowConfig(
                string(data, "entry", configPath),
                maxDepth,
                string(data, "entryName", configPath),
                toSet(strings(data, "excludeDirs", configPath)),
                toList(strings(data, "excludePatterns", configPath)),
                toList(strings(data, "entryExclusions", configPath)),
                parallelism,
                bool(data, "withMermaid", configPath),
                mermaidMaxNodes,
                bool(data, "respectGitignore", configPath));
    }

    /**
     * Load {@code cflow.yaml} from a directory if there is one.
     */
    public static CflowConfig loadFromDirectory(Path directory) throws IOException {
        Path file = directory.resolve(DEFAULT_FILE_NAME);
        if (Files.isDirectory(directory) && Files.isRegularFile(file)) {
            return load(file);
        }
        return empty();
    }

    private static String string(Map<?, ?> data, String key, Path configPath) throws IOException {
        Object value = data.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String s)) {
            throw new IOException("'" + key + "' must be a string in " + configPath);
        }
        return s.isBlank() ? null : s.trim();
    }

    private static Integer integer(Map<?, ?> data, String key, Path configPath) throws IOException {
        Object value = data.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Integer i)) {
            throw new IOException("'" + key + "' must be an integer in " + configPath);
        }
        return i;
    }

    private static Boolean bool(Map<?, ?> data, String key, Path configPath) throws IOException {
        Object value = data.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Boolean b)) {
            throw new IOException("'" + key + "' must be true or false in " + configPath);
        }
        return b;
    }

    private static List<?> strings(Map<?, ?> data, String key, Path configPath) throws IOException {
        Object value = data.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new IOException("'" + key + "' must be a list in " + configPath);
        }
        return list;
    }

    private static Set<String> toSet(List<?> list) {
        if (list.isEmpty()) {
            return Set.of();
        }
        Set<String> result = new LinkedHashSet<>();
        for (Object item : list) {
            if (item != null) {
                String trimmed = item.toString().trim();
                if (!trimmed.isEmpty()) {
                    result.add(trimmed);
                }
            }
        }
        return Collections.unmodifiableSet(result);
    }

    private static List<String> toList(List<?> list) {
        return list.stream()
                .filter(s -> s != null && !s.toString().trim().isEmpty())
                .map(s -> s.toString().trim())
                .toList();
    }

    public String getEntry() {
        return entry;
    }

    public Integer getMaxDepth() {
        return maxDepth;
    }

    public String getEntryName() {
        return entryName;
    }

    public Set<String> getExcludeDirs() {
        return excludeDirs;
    }

    public List<String> getExcludePatterns() {
        return excludePatterns;
    }

    public List<String> getEntryExclusions() {
        return entryExclusions;
    }

    public Integer getParallelism() {
        return parallelism;
    }

    public Boolean getWithMermaid() {
        return withMermaid;
    }

    public Integer getMermaidMaxNodes() {
        return mermaidMaxNodes;
    }

    public Boolean getRespectGitignore() {
        return respectGitignore;
    }
}
