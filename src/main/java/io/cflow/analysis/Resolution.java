package io.cflow.analysis;

import io.cflow.model.CallSite;
import io.cflow.model.Definition;
import io.cflow.model.ResolutionReason;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of resolving one call site.
 */
public sealed interface Resolution {

    /**
     * The call site resolves to exactly one definition.
     */
    record Resolved(CallSite callSite, Definition target, ResolutionReason reason) implements Resolution {
    }

    /**
     * Several classes define the method and nothing narrows the receiver;
     * the first registered candidate is used.
     */
    record AmbiguousFirstMatch(CallSite callSite, Definition target, List<Definition> candidates)
            implements Resolution {
        public AmbiguousFirstMatch {
            candidates = List.copyOf(candidates);
        }
    }

    /**
     * No definition could be chosen. The call produces no edge.
     */
    record Unresolved(CallSite callSite, Cause cause) implements Resolution {
    }

    /**
     * Why a call site stayed unresolved.
     */
    enum Cause {
        /** Bare name that is neither a known class nor a known function (builtins, imports). */
        UNKNOWN_NAME,
        /** Known class without an {@code __init__}. */
        NO_CONSTRUCTOR,
        /** Receiver class is known but neither it nor its bases define the method. */
        NOT_ON_RECEIVER_CLASS,
        /** No class defines a method with this name. */
        UNKNOWN_METHOD,
        /** Callee is not a plain name or attribute. */
        DYNAMIC_CALLEE
    }

    CallSite callSite();

    /**
     * The chosen definition, if any.
     */
    default Optional<Definition> chosen() {
        if (this instanceof Resolved r) {
            return Optional.of(r.target());
        } else if (this instanceof AmbiguousFirstMatch a) {
            return Optional.of(a.target());
        }
        return Optional.empty();
    }

    /**
     * The rule that produced the target, empty when unresolved.
     */
    default Optional<ResolutionReason> resolvedBy() {
        if (this instanceof Resolved r) {
            return Optional.of(r.reason());
        } else if (this instanceof AmbiguousFirstMatch) {
            return Optional.of(ResolutionReason.AMBIGUOUS_FIRST_MATCH);
        }
        return Optional.empty();
    }

    default boolean isResolved() {
        return !(this instanceof Unresolved);
    }
}
