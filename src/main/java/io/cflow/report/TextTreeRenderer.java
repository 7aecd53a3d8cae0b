package io.cflow.report;

import io.cflow.graph.CallTree;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders call trees as an ASCII tree.
 * <pre>
 * main (app.py:12)
 * ├── Service.__init__ (service.py:4)
 * └── Service.run (service.py:8)
 *     └── helper (util.py:1)
 *         └── Service.run (recursive) (service.py:8)
 * </pre>
 */
public class TextTreeRenderer {
    static final String BRANCH = "├── ";
    static final String LAST_BRANCH = "└── ";
    static final String PIPE = "│   ";
    static final String SPACE = "    ";

    /** Entry points shown when none of them calls anything. */
    static final int MAX_CALLEELESS_ENTRIES = 5;

    /**
     * Render all trees. Entry points without callees are left out when at least
     * one entry point has callees.
     */
    public String render(List<CallTree> trees) {
        List<CallTree> shown = trees.stream().filter(CallTree::hasChildren).toList();
        if (shown.isEmpty()) {
            shown = trees.stream()
                    .limit(MAX_CALLEELESS_ENTRIES)
                    .toList();
        }

        List<String> lines = new ArrayList<>();
        for (int i = 0; i < shown.size(); i++) {
            if (i > 0) {
                lines.add("");
            }
            renderRoot(shown.get(i), lines);
        }
        return String.join("\n", lines);
    }

    /**
     * Render one tree.
     */
    public String render(CallTree tree) {
        List<String> lines = new ArrayList<>();
        renderRoot(tree, lines);
        return String.join("\n", lines);
    }

    private void renderRoot(CallTree root, List<String> lines) {
        lines.add(label(root));
        if (root.truncated()) {
            lines.add(LAST_BRANCH + "...");
        }
        renderChildren(root, "", lines);
    }

    private void renderNode(CallTree node, String prefix, boolean last, List<String> lines) {
        lines.add(prefix + (last ? LAST_BRANCH : BRANCH) + label(node));
        String childPrefix = prefix + (last ? SPACE : PIPE);
        if (node.truncated()) {
            lines.add(childPrefix + LAST_BRANCH + "...");
        }
        renderChildren(node, childPrefix, lines);
    }

    private void renderChildren(CallTree node, String prefix, List<String> lines) {
        List<CallTree> children = node.children();
        for (int i = 0; i < children.size(); i++) {
            renderNode(children.get(i), prefix, i == children.size() - 1, lines);
        }
    }

    private static String label(CallTree node) {
        StringBuilder sb = new StringBuilder(node.definition().qualifiedName());
        if (node.recursive()) {
            sb.append(" (recursive)");
        }
        sb.append(" (").append(node.definition().location().shortForm()).append(')');
        return sb.toString();
    }
}
