package io.cflow.analysis;

/**
 * Headline numbers of one analysis run.
 *
 * @param filesAnalyzed   Files parsed successfully
 * @param parseFailures   Files skipped because they did not parse
 * @param classes         Distinct class names
 * @param definitions     Nodes in the call graph
 * @param entryPoints     Roots selected
 * @param callEdges       Edges in the call graph
 * @param resolvedCalls   Call sites that produced or reinforced an edge
 * @param unresolvedCalls Call sites dropped
 * @param ambiguousCalls  Call sites resolved by first match among several candidates
 */
public record AnalysisSummary(
        int filesAnalyzed,
        int parseFailures,
        int classes,
        int definitions,
        int entryPoints,
        int callEdges,
        int resolvedCalls,
        int unresolvedCalls,
        int ambiguousCalls
) {
}
