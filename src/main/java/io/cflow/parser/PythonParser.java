package io.cflow.parser;

import io.cflow.model.SourceFile;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterPython;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Parses Python source with tree-sitter.
 * <p>
 * A {@link TSParser} is not thread-safe, so each worker thread gets its own.
 * Files that do not parse cleanly are rejected: a partial tree would produce
 * call sites attributed to the wrong definitions.
 */
public class PythonParser {

    private final ThreadLocal<TSParser> parsers = ThreadLocal.withInitial(() -> {
        TSParser parser = new TSParser();
        parser.setLanguage(new TreeSitterPython());
        return parser;
    });

    /**
     * Parse one source file.
     *
     * @throws ParseException if the file contains syntax errors or tree-sitter fails
     */
    public ParsedModule parse(SourceFile file) throws ParseException {
        SourceText source = SourceText.of(file.text());
        TSTree tree;
        try {
            tree = parsers.get().parseString(null, source.text());
        } catch (RuntimeException e) {
            throw new ParseException(file.path(), "tree-sitter failed: " + e.getMessage(), e);
        }
        if (tree == null) {
            throw new ParseException(file.path(), 0, "tree-sitter returned no tree");
        }
        TSNode root = tree.getRootNode();
        if (root.hasError()) {
            int line = firstErrorNode(root)
                    .map(n -> n.getStartPoint().getRow() + 1)
                    .orElse(0);
            throw new ParseException(file.path(), line, "syntax error");
        }
        return new ParsedModule(file.path(), source, tree);
    }

    /**
     * Finds the first ERROR or missing node in document order.
     */
    static Optional<TSNode> firstErrorNode(TSNode root) {
        Deque<TSNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TSNode node = stack.pop();
            if (PythonNodeTypes.ERROR.equals(node.getType()) || node.isMissing()) {
                return Optional.of(node);
            }
            if (!node.hasError()) {
                continue;
            }
            for (int i = node.getChildCount() - 1; i >= 0; i--) {
                TSNode child = node.getChild(i);
                if (child != null && !child.isNull()) {
                    stack.push(child);
                }
            }
        }
        return Optional.empty();
    }
}
