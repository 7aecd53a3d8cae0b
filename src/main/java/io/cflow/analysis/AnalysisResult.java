package io.cflow.analysis;

import io.cflow.graph.CallGraph;
import io.cflow.graph.CallTree;
import io.cflow.graph.EntryPoint;
import io.cflow.model.ParseFailure;

import java.util.List;

/**
 * Everything a run produces, ready for rendering.
 *
 * @param graph       The call graph
 * @param entryPoints Selected roots, in selection order
 * @param trees       One call tree per entry point
 * @param failures    Files that were skipped
 * @param stats       Resolution counters
 * @param summary     Headline numbers
 */
public record AnalysisResult(
        CallGraph graph,
        List<EntryPoint> entryPoints,
        List<CallTree> trees,
        List<ParseFailure> failures,
        ResolutionStats stats,
        AnalysisSummary summary
) {
    public AnalysisResult {
        entryPoints = List.copyOf(entryPoints);
        trees = List.copyOf(trees);
        failures = List.copyOf(failures);
    }

    public boolean hasDefinitions() {
        return !graph.isEmpty();
    }
}
