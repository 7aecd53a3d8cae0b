package io.cflow.analysis;

import io.cflow.graph.EntryPointSelector;
import io.cflow.graph.TreeMaterializer;

import java.util.ArrayList;
import java.util.List;

/**
 * Knobs of one analysis run.
 *
 * @param entryName        Explicit entry point, or null to select automatically
 * @param reservedName     Name that always makes a module-level function a root
 * @param maxDepth         Depth bound of the call trees
 * @param entryExclusions  Name patterns never selected as automatic roots
 * @param parallelism      Worker threads for parsing, 1 parses on the calling thread
 */
public record AnalysisOptions(
        String entryName,
        String reservedName,
        int maxDepth,
        List<String> entryExclusions,
        int parallelism
) {
    public AnalysisOptions {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("Max depth must be >= 0, got " + maxDepth);
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be >= 1, got " + parallelism);
        }
        if (reservedName == null || reservedName.isBlank()) {
            reservedName = EntryPointSelector.DEFAULT_ENTRY_NAME;
        }
        entryExclusions = entryExclusions == null ? List.of() : List.copyOf(entryExclusions);
    }

    public static AnalysisOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String entryName;
        private String reservedName = EntryPointSelector.DEFAULT_ENTRY_NAME;
        private int maxDepth = TreeMaterializer.DEFAULT_MAX_DEPTH;
        private final List<String> entryExclusions = new ArrayList<>();
        private int parallelism = Runtime.getRuntime().availableProcessors();

        public Builder entryName(String entryName) {
            this.entryName = entryName;
            return this;
        }

        public Builder reservedName(String reservedName) {
            this.reservedName = reservedName;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder entryExclusions(List<String> patterns) {
            this.entryExclusions.addAll(patterns);
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public AnalysisOptions build() {
            return new AnalysisOptions(entryName, reservedName, maxDepth, entryExclusions, parallelism);
        }
    }
}
