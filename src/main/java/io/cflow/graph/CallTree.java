package io.cflow.graph;

import io.cflow.model.Definition;

import java.util.List;

/**
 * One node of a materialized call tree.
 *
 * @param definition   The definition at this node
 * @param depth        Distance from the root, the root being 0
 * @param multiplicity Call sites of the edge leading here, 1 for the root
 * @param recursive    The definition already appears on the path from the root; not expanded
 * @param truncated    The depth bound was reached while the definition still has callees; not expanded
 * @param children     Callees in first call site order
 */
public record CallTree(
        Definition definition,
        int depth,
        int multiplicity,
        boolean recursive,
        boolean truncated,
        List<CallTree> children
) {
    public CallTree {
        children = children == null ? List.of() : List.copyOf(children);
        if ((recursive || truncated) && !children.isEmpty()) {
            throw new IllegalArgumentException("Unexpanded node cannot have children: " + definition.qualifiedName());
        }
        if (recursive && truncated) {
            throw new IllegalArgumentException("Node cannot be both recursive and truncated: " + definition.qualifiedName());
        }
    }

    public static CallTree leaf(Definition definition, int depth, int multiplicity) {
        return new CallTree(definition, depth, multiplicity, false, false, List.of());
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    /**
     * Total number of nodes in this subtree, this node included.
     */
    public int size() {
        int size = 1;
        for (CallTree child : children) {
            size += child.size();
        }
        return size;
    }

    /**
     * Depth of the deepest node in this subtree.
     */
    public int maxDepth() {
        int max = depth;
        for (CallTree child : children) {
            max = Math.max(max, child.maxDepth());
        }
        return max;
    }
}
