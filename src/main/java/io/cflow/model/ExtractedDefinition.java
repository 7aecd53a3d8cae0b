package io.cflow.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * A definition together with everything its own body does.
 * Calls made inside nested definitions belong to those definitions, not to this one.
 *
 * @param definition  The definition
 * @param callSites   Call sites in evaluation order
 * @param assignments Assignments in source order
 */
public record ExtractedDefinition(
        Definition definition,
        List<CallSite> callSites,
        List<Assignment> assignments
) {
    public ExtractedDefinition {
        if (definition == null) {
            throw new IllegalArgumentException("Definition cannot be null");
        }
        callSites = callSites == null ? List.of() : List.copyOf(callSites);
        assignments = assignments == null ? List.of() : List.copyOf(assignments);
    }

    /**
     * Call sites and assignments merged in the order they take effect.
     * On equal offsets a call comes before an assignment, as in {@code x = Foo()}.
     */
    public List<BodyEvent> events() {
        List<BodyEvent> events = new ArrayList<>(callSites.size() + assignments.size());
        events.addAll(callSites);
        events.addAll(assignments);
        events.sort(Comparator.comparingInt(BodyEvent::offset));
        return events;
    }
}
