package io.cflow.analysis;

import io.cflow.graph.CallEdge;
import io.cflow.graph.CallGraph;
import io.cflow.model.Definition;
import io.cflow.model.ResolutionReason;
import io.cflow.model.SourceLocation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulates nodes and resolved calls into a {@link CallGraph}.
 * <p>
 * Unresolved calls are dropped. Repeated calls between the same pair of
 * definitions collapse into one edge whose multiplicity counts them; the edge
 * keeps the location and reason of the first call site.
 */
public class CallGraphBuilder {
    private final List<Definition> nodes = new ArrayList<>();
    private final Map<String, PendingEdge> edges = new LinkedHashMap<>();

    private static final class PendingEdge {
        private final Definition caller;
        private final Definition callee;
        private final SourceLocation firstSite;
        private final ResolutionReason reason;
        private int multiplicity;

        private PendingEdge(Definition caller, Definition callee, SourceLocation firstSite, ResolutionReason reason) {
            this.caller = caller;
            this.callee = callee;
            this.firstSite = firstSite;
            this.reason = reason;
        }

        private CallEdge toEdge() {
            return new CallEdge(caller, callee, firstSite, multiplicity, reason);
        }
    }

    public CallGraphBuilder addNode(Definition definition) {
        nodes.add(definition);
        return this;
    }

    /**
     * Record the outcome of one call site made by {@code caller}.
     *
     * @return true if an edge was added or incremented
     */
    public boolean addCall(Definition caller, Resolution resolution) {
        if (resolution.chosen().isEmpty()) {
            return false;
        }
        Definition callee = resolution.chosen().get();
        ResolutionReason reason = resolution.resolvedBy().orElseThrow();
        String key = caller.id().key() + " -> " + callee.id().key();
        PendingEdge edge = edges.computeIfAbsent(key,
                k -> new PendingEdge(caller, callee, resolution.callSite().location(), reason));
        edge.multiplicity++;
        return true;
    }

    /**
     * Build the graph. Fails if an edge references a definition that was never added as a node.
     */
    public CallGraph build() {
        List<CallEdge> built = new ArrayList<>(edges.size());
        for (PendingEdge edge : edges.values()) {
            built.add(edge.toEdge());
        }
        return new CallGraph(nodes, built);
    }
}
