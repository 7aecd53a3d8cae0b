package io.cflow.graph;

import io.cflow.model.Definition;
import io.cflow.model.ResolutionReason;
import io.cflow.model.SourceLocation;

/**
 * A resolved call relation. All call sites from one caller to one callee
 * collapse into a single edge.
 *
 * @param caller       The calling definition
 * @param callee       The called definition
 * @param firstSite    Location of the first call site, in source order
 * @param multiplicity Number of call sites this edge stands for
 * @param reason       Resolution rule of the first call site
 */
public record CallEdge(
        Definition caller,
        Definition callee,
        SourceLocation firstSite,
        int multiplicity,
        ResolutionReason reason
) {
    public CallEdge {
        if (caller == null || callee == null) {
            throw new IllegalArgumentException("Edge endpoints cannot be null");
        }
        if (multiplicity < 1) {
            throw new IllegalArgumentException("Edge multiplicity must be >= 1, got " + multiplicity);
        }
    }

    /**
     * True for a definition calling itself directly.
     */
    public boolean recursive() {
        return caller.id().equals(callee.id());
    }

    /**
     * Unique key for this edge (caller -> callee).
     */
    public String key() {
        return caller.id().key() + " -> " + callee.id().key();
    }
}
