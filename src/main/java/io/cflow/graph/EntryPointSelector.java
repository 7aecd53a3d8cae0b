package io.cflow.graph;

import io.cflow.model.Definition;
import io.cflow.model.DefinitionId;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chooses the roots of the call trees.
 * <p>
 * With an explicit name, the first definition whose qualified name matches
 * (falling back to the simple name) is the only root. Otherwise every
 * module-level function with the reserved entry name is a root, whatever
 * calls it, followed by every definition nothing else calls.
 */
public class EntryPointSelector {
    private static final Logger log = LogManager.getLogger(EntryPointSelector.class);

    public static final String DEFAULT_ENTRY_NAME = "main";

    private final CallGraph graph;
    private final String reservedName;
    private final EntryExclusions exclusions;

    public EntryPointSelector(CallGraph graph) {
        this(graph, DEFAULT_ENTRY_NAME, EntryExclusions.none());
    }

    public EntryPointSelector(CallGraph graph, String reservedName, EntryExclusions exclusions) {
        this.graph = graph;
        this.reservedName = reservedName == null || reservedName.isBlank() ? DEFAULT_ENTRY_NAME : reservedName;
        this.exclusions = exclusions == null ? EntryExclusions.none() : exclusions;
    }

    /**
     * Select entry points; a null or blank name selects automatically.
     *
     * @throws NoEntryPointFoundException if a name is given and nothing matches it
     */
    public List<EntryPoint> select(String explicitName) throws NoEntryPointFoundException {
        if (explicitName == null || explicitName.isBlank()) {
            return selectAutomatic();
        }
        return List.of(selectExplicit(explicitName.trim()));
    }

    public EntryPoint selectExplicit(String name) throws NoEntryPointFoundException {
        List<Definition> matches = graph.findByQualifiedName(name);
        if (matches.isEmpty()) {
            matches = graph.findByName(name);
        }
        if (matches.isEmpty()) {
            throw new NoEntryPointFoundException(name);
        }
        if (matches.size() > 1) {
            log.info("Entry point '{}' matches {} definitions, using {}",
                    name, matches.size(), matches.get(0).location());
        }
        return new EntryPoint(matches.get(0), EntryPoint.Reason.EXPLICIT);
    }

    public List<EntryPoint> selectAutomatic() {
        Map<DefinitionId, EntryPoint> selected = new LinkedHashMap<>();
        for (Definition node : graph.nodes()) {
            if (node.qualifiedName().equals(reservedName)) {
                selected.put(node.id(), new EntryPoint(node, EntryPoint.Reason.NAMED_MAIN));
            }
        }
        for (Definition node : graph.nodes()) {
            if (selected.containsKey(node.id()) || exclusions.excludes(node)) {
                continue;
            }
            if (graph.callerCount(node) == 0) {
                selected.put(node.id(), new EntryPoint(node, EntryPoint.Reason.UNCALLED));
            }
        }
        log.debug("Selected {} entry points from {} definitions", selected.size(), graph.nodeCount());
        return new ArrayList<>(selected.values());
    }
}
