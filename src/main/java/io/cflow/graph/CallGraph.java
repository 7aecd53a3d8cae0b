package io.cflow.graph;

import io.cflow.model.Definition;
import io.cflow.model.DefinitionId;

import java.util.*;

/**
 * Directed call graph over definitions.
 * <p>
 * Every definition found in the analyzed files is a node, whether or not it
 * takes part in any call. Edges only connect nodes of this graph, and there is
 * at most one edge per (caller, callee) pair. Outgoing edges keep the order of
 * their first call site.
 */
public class CallGraph {

    private final Map<DefinitionId, Definition> nodes;
    private final List<CallEdge> edges;
    private final Map<DefinitionId, List<CallEdge>> outgoing;
    private final Map<DefinitionId, List<CallEdge>> incoming;

    public CallGraph(Collection<Definition> nodes, List<CallEdge> edges) {
        Map<DefinitionId, Definition> nodeMap = new LinkedHashMap<>();
        for (Definition node : nodes) {
            nodeMap.putIfAbsent(node.id(), node);
        }
        Map<DefinitionId, List<CallEdge>> out = new HashMap<>();
        Map<DefinitionId, List<CallEdge>> in = new HashMap<>();
        Set<String> seen = new HashSet<>();
        for (CallEdge edge : edges) {
            if (!nodeMap.containsKey(edge.caller().id())) {
                throw new IllegalArgumentException("Edge caller is not a node: " + edge.key());
            }
            if (!nodeMap.containsKey(edge.callee().id())) {
                throw new IllegalArgumentException("Edge callee is not a node: " + edge.key());
            }
            if (!seen.add(edge.key())) {
                throw new IllegalArgumentException("Duplicate edge: " + edge.key());
            }
            out.computeIfAbsent(edge.caller().id(), k -> new ArrayList<>()).add(edge);
            in.computeIfAbsent(edge.callee().id(), k -> new ArrayList<>()).add(edge);
        }
        this.nodes = Collections.unmodifiableMap(nodeMap);
        this.edges = List.copyOf(edges);
        this.outgoing = copyOf(out);
        this.incoming = copyOf(in);
    }

    private static Map<DefinitionId, List<CallEdge>> copyOf(Map<DefinitionId, List<CallEdge>> map) {
        Map<DefinitionId, List<CallEdge>> copy = new HashMap<>();
        map.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * All nodes in registration order.
     */
    public List<Definition> nodes() {
        return List.copyOf(nodes.values());
    }

    public Optional<Definition> node(DefinitionId id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public boolean contains(Definition definition) {
        return nodes.containsKey(definition.id());
    }

    /**
     * All edges in insertion order.
     */
    public List<CallEdge> edges() {
        return edges;
    }

    /**
     * Edges leaving the given definition, in first call site order.
     */
    public List<CallEdge> callees(Definition caller) {
        return outgoing.getOrDefault(caller.id(), List.of());
    }

    /**
     * Edges arriving at the given definition.
     */
    public List<CallEdge> callers(Definition callee) {
        return incoming.getOrDefault(callee.id(), List.of());
    }

    /**
     * Number of distinct callers, a definition calling itself not counted.
     */
    public int callerCount(Definition callee) {
        int count = 0;
        for (CallEdge edge : callers(callee)) {
            if (!edge.recursive()) {
                count++;
            }
        }
        return count;
    }

    /**
     * Nodes whose qualified name matches exactly, in registration order.
     */
    public List<Definition> findByQualifiedName(String qualifiedName) {
        return nodes.values().stream()
                .filter(d -> d.qualifiedName().equals(qualifiedName))
                .toList();
    }

    /**
     * Nodes whose simple name matches, in registration order.
     */
    public List<Definition> findByName(String name) {
        return nodes.values().stream()
                .filter(d -> d.name().equals(name))
                .toList();
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * Create an empty call graph.
     */
    public static CallGraph empty() {
        return new CallGraph(List.of(), List.of());
    }
}
