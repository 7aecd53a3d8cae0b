package io.cflow.discovery;

import org.eclipse.jgit.ignore.IgnoreNode;
import org.eclipse.jgit.ignore.IgnoreNode.MatchResult;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * {@code .gitignore} rules of the analyzed root, matched by JGit.
 * The last matching rule decides, and an entry no rule matches is kept.
 */
public class IgnoreRules {

    private final IgnoreNode node;

    private IgnoreRules(IgnoreNode node) {
        this.node = node;
    }

    public static IgnoreRules empty() {
        return new IgnoreRules(new IgnoreNode());
    }

    /**
     * Load {@code .gitignore} from a directory, or no rules if there is none.
     */
    public static IgnoreRules load(Path directory) throws IOException {
        Path file = directory.resolve(".gitignore");
        if (!Files.isRegularFile(file)) {
            return empty();
        }
        IgnoreNode node = new IgnoreNode();
        try (InputStream in = Files.newInputStream(file)) {
            node.parse(in);
        }
        return new IgnoreRules(node);
    }

    public static IgnoreRules parse(List<String> lines) {
        IgnoreNode node = new IgnoreNode();
        byte[] content = String.join("\n", lines).getBytes(StandardCharsets.UTF_8);
        try {
            node.parse(new ByteArrayInputStream(content));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return new IgnoreRules(node);
    }

    /**
     * @param relativePath '/'-separated path relative to the directory holding the rules
     * @param isDirectory  whether the entry is a directory
     */
    public boolean isIgnored(String relativePath, boolean isDirectory) {
        return node.isIgnored(relativePath, isDirectory) == MatchResult.IGNORED;
    }

    public int size() {
        return node.getRules().size();
    }
}
