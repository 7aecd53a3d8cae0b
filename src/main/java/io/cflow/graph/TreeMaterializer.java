package io.cflow.graph;

import io.cflow.model.Definition;
import io.cflow.model.DefinitionId;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Expands entry points into depth-bounded call trees.
 * <p>
 * Expansion is depth first. A definition already on the path from the root
 * is emitted as a recursive leaf; a definition reached at the depth bound
 * that still has callees is emitted as a truncated leaf. The path is tracked
 * per branch, so the same definition may be fully expanded in sibling
 * subtrees.
 */
public class TreeMaterializer {
    public static final int DEFAULT_MAX_DEPTH = 10;

    private final CallGraph graph;
    private final int maxDepth;
    // Arena index of every node, used for the on-path flags
    private final Map<DefinitionId, Integer> arena = new HashMap<>();

    public TreeMaterializer(CallGraph graph) {
        this(graph, DEFAULT_MAX_DEPTH);
    }

    public TreeMaterializer(CallGraph graph, int maxDepth) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("Max depth must be >= 0, got " + maxDepth);
        }
        this.graph = graph;
        this.maxDepth = maxDepth;
        for (Definition node : graph.nodes()) {
            arena.put(node.id(), arena.size());
        }
    }

    /**
     * One tree per entry point, in entry order.
     */
    public List<CallTree> materializeAll(List<EntryPoint> entryPoints) {
        List<CallTree> trees = new ArrayList<>(entryPoints.size());
        for (EntryPoint entry : entryPoints) {
            trees.add(materialize(entry.definition()));
        }
        return trees;
    }

    public CallTree materialize(Definition root) {
        if (!graph.contains(root)) {
            throw new IllegalArgumentException("Not a node of the call graph: " + root.qualifiedName());
        }
        boolean[] onPath = new boolean[arena.size()];
        return visit(root, 0, 1, onPath);
    }

    private CallTree visit(Definition definition, int depth, int multiplicity, boolean[] onPath) {
        int index = arena.get(definition.id());
        if (onPath[index]) {
            return new CallTree(definition, depth, multiplicity, true, false, List.of());
        }
        List<CallEdge> callees = graph.callees(definition);
        if (callees.isEmpty()) {
            return CallTree.leaf(definition, depth, multiplicity);
        }
        if (depth >= maxDepth) {
            return new CallTree(definition, depth, multiplicity, false, true, List.of());
        }

        onPath[index] = true;
        List<CallTree> children = new ArrayList<>(callees.size());
        for (CallEdge edge : callees) {
            children.add(visit(edge.callee(), depth + 1, edge.multiplicity(), onPath));
        }
        onPath[index] = false;
        return new CallTree(definition, depth, multiplicity, false, false, children);
    }

    public int maxDepth() {
        return maxDepth;
    }
}
