package io.cflow.report;

import io.cflow.graph.CallTree;
import io.cflow.model.Definition;
import io.cflow.model.DefinitionId;

import java.util.*;

/**
 * Renders call trees as a Mermaid flowchart in a fenced block.
 * <p>
 * Only nodes and calls that appear in the trees are drawn. Above the node
 * limit the chart is reduced to the entry points and their direct callees.
 */
public class MermaidRenderer {
    public static final int DEFAULT_MAX_NODES = 50;
    static final int MAX_LABEL_LENGTH = 30;

    private final int maxNodes;

    public MermaidRenderer() {
        this(DEFAULT_MAX_NODES);
    }

    public MermaidRenderer(int maxNodes) {
        if (maxNodes < 1) {
            throw new IllegalArgumentException("Max nodes must be >= 1, got " + maxNodes);
        }
        this.maxNodes = maxNodes;
    }

    private record Link(Definition from, Definition to) {
    }

    public String render(List<CallTree> trees) {
        Map<DefinitionId, Definition> entries = new LinkedHashMap<>();
        Map<DefinitionId, Definition> nodes = new LinkedHashMap<>();
        Set<Link> links = new LinkedHashSet<>();
        for (CallTree tree : trees) {
            entries.putIfAbsent(tree.definition().id(), tree.definition());
            collect(tree, nodes, links);
        }

        if (nodes.size() > maxNodes) {
            Map<DefinitionId, Definition> limited = new LinkedHashMap<>(entries);
            for (Link link : links) {
                if (entries.containsKey(link.from().id())) {
                    limited.putIfAbsent(link.to().id(), link.to());
                }
            }
            nodes = limited;
        }

        Map<DefinitionId, String> ids = assignIds(nodes.values());

        List<String> lines = new ArrayList<>();
        lines.add("```mermaid");
        lines.add("---");
        lines.add("config:");
        lines.add("  layout: elk");
        lines.add("---");
        lines.add("flowchart TD");

        lines.add("");
        lines.add("    %% Entry points");
        for (Definition entry : entries.values()) {
            if (nodes.containsKey(entry.id())) {
                lines.add("    " + ids.get(entry.id()) + "[\"" + label(entry.qualifiedName()) + "\"]:::entry");
            }
        }

        lines.add("");
        lines.add("    %% Functions");
        nodes.values().stream()
                .filter(d -> !entries.containsKey(d.id()))
                .sorted(Comparator.comparing(Definition::qualifiedName))
                .forEach(d -> lines.add("    " + ids.get(d.id()) + "[\"" + label(d.qualifiedName()) + "\"]"));

        lines.add("");
        lines.add("    %% Call relationships");
        for (Link link : links) {
            String from = ids.get(link.from().id());
            String to = ids.get(link.to().id());
            if (from != null && to != null) {
                lines.add("    " + from + " --> " + to);
            }
        }

        lines.add("");
        lines.add("    %% Styling");
        lines.add("    classDef entry fill:#4CAF50,stroke:#2E7D32,color:#fff");
        lines.add("```");
        return String.join("\n", lines);
    }

    private static void collect(CallTree node, Map<DefinitionId, Definition> nodes, Set<Link> links) {
        nodes.putIfAbsent(node.definition().id(), node.definition());
        for (CallTree child : node.children()) {
            links.add(new Link(node.definition(), child.definition()));
            collect(child, nodes, links);
        }
    }

    /**
     * Mermaid ids from qualified names; same-named definitions from different
     * files get a numeric suffix.
     */
    private static Map<DefinitionId, String> assignIds(Collection<Definition> definitions) {
        Map<DefinitionId, String> ids = new HashMap<>();
        Set<String> used = new HashSet<>();
        for (Definition definition : definitions) {
            String base = safeId(definition.qualifiedName());
            String id = base;
            int n = 2;
            while (!used.add(id)) {
                id = base + "_" + n++;
            }
            ids.put(definition.id(), id);
        }
        return ids;
    }

    static String safeId(String name) {
        return name.replace('.', '_').replace('-', '_');
    }

    /**
     * Long dotted names keep their first and last segment: {@code VeryLongClassName...method}.
     */
    static String label(String name) {
        if (name.length() > MAX_LABEL_LENGTH) {
            String[] parts = name.split("\\.");
            if (parts.length > 1) {
                return parts[0] + "..." + parts[parts.length - 1];
            }
        }
        return name;
    }
}
