package io.cflow.analysis;

import io.cflow.model.ResolutionReason;

import java.util.*;

/**
 * Counts resolution outcomes over a run.
 */
public class ResolutionStats {
    private final Map<ResolutionReason, Integer> resolved = new EnumMap<>(ResolutionReason.class);
    private final Map<Resolution.Cause, Integer> unresolved = new EnumMap<>(Resolution.Cause.class);
    // callee text of unresolved calls, e.g. print, os.path.join
    private final Set<String> externalCalls = new TreeSet<>();

    public void record(Resolution resolution) {
        if (resolution instanceof Resolution.Unresolved u) {
            unresolved.merge(u.cause(), 1, Integer::sum);
            externalCalls.add(u.callSite().calleeText());
        } else {
            resolution.resolvedBy().ifPresent(reason -> resolved.merge(reason, 1, Integer::sum));
        }
    }

    public int resolvedCount() {
        return resolved.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int unresolvedCount() {
        return unresolved.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int count(ResolutionReason reason) {
        return resolved.getOrDefault(reason, 0);
    }

    public int count(Resolution.Cause cause) {
        return unresolved.getOrDefault(cause, 0);
    }

    public int ambiguousCount() {
        return count(ResolutionReason.AMBIGUOUS_FIRST_MATCH);
    }

    /**
     * Distinct callee texts that resolved to nothing, sorted.
     */
    public Set<String> externalCalls() {
        return Collections.unmodifiableSet(externalCalls);
    }

    public Map<ResolutionReason, Integer> resolvedByReason() {
        return Collections.unmodifiableMap(resolved);
    }
}
