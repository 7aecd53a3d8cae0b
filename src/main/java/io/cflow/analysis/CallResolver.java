package io.cflow.analysis;

import io.cflow.model.*;

import java.util.*;

/**
 * Resolves call sites to definitions using the global {@link ScopeRegistry}.
 * <p>
 * Rules, first match wins:
 * <ol>
 *   <li>Bare name of a known class: its constructor.</li>
 *   <li>Other bare name: the module function with that name.</li>
 *   <li>Receiver bound to a class by an earlier {@code x = Class(...)} in the same
 *       body, or receiver that is itself a class name: that class's method.</li>
 *   <li>{@code self}/{@code cls} inside a method: the enclosing class's method.</li>
 *   <li>Any other receiver: the only class defining the method, or the first
 *       registered one when several do.</li>
 * </ol>
 * Lookups on a known class search its bases depth first in declaration order.
 * When the receiver class is known but no class in its hierarchy defines the
 * method, the call stays unresolved rather than being matched by name alone.
 */
public class CallResolver {
    static final Set<String> SELF_NAMES = Set.of("self", "cls");
    static final String SUPER_CALL = "super()";

    private final ScopeRegistry registry;

    public CallResolver(ScopeRegistry registry) {
        this.registry = registry;
    }

    /**
     * Resolve every call site of one body, replaying assignments and calls in
     * offset order so bindings only apply to later calls.
     *
     * @return one resolution per call site, in source order
     */
    public List<Resolution> resolveBody(ExtractedDefinition body) {
        VariableBindings bindings = new VariableBindings();
        List<Resolution> resolutions = new ArrayList<>(body.callSites().size());
        for (BodyEvent event : body.events()) {
            if (event instanceof Assignment assignment) {
                apply(assignment, bindings);
            } else if (event instanceof CallSite callSite) {
                resolutions.add(resolve(callSite, body.definition(), bindings));
            }
        }
        return resolutions;
    }

    /**
     * Bind the target when the value constructs a known class, otherwise forget it.
     */
    void apply(Assignment assignment, VariableBindings bindings) {
        if (assignment.hasConstructorCandidate() && registry.isClass(assignment.constructorCandidate())) {
            bindings.bind(assignment.target(), assignment.constructorCandidate());
        } else {
            bindings.clear(assignment.target());
        }
    }

    /**
     * Resolve a single call site made from {@code caller}.
     */
    public Resolution resolve(CallSite site, Definition caller, VariableBindings bindings) {
        return switch (site.form()) {
            case BARE -> resolveBare(site);
            case ATTRIBUTE -> resolveAttribute(site, caller, bindings);
            case OTHER -> new Resolution.Unresolved(site, Resolution.Cause.DYNAMIC_CALLEE);
        };
    }

    private Resolution resolveBare(CallSite site) {
        String name = site.name();
        if (registry.isClass(name)) {
            return lookup(name, Definition.CONSTRUCTOR_NAME)
                    .<Resolution>map(found -> new Resolution.Resolved(site, found.definition(),
                            ResolutionReason.CONSTRUCTOR))
                    .orElseGet(() -> new Resolution.Unresolved(site, Resolution.Cause.NO_CONSTRUCTOR));
        }
        return registry.resolveModuleCall(name)
                .<Resolution>map(f -> new Resolution.Resolved(site, f, ResolutionReason.MODULE_FUNCTION))
                .orElseGet(() -> new Resolution.Unresolved(site, Resolution.Cause.UNKNOWN_NAME));
    }

    private Resolution resolveAttribute(CallSite site, Definition caller, VariableBindings bindings) {
        String receiver = site.receiver();
        String method = site.name();

        Optional<String> bound = bindings.classOf(receiver);
        if (bound.isPresent()) {
            return onClass(site, bound.get(), method, ResolutionReason.TRACKED_RECEIVER);
        }
        if (registry.isClass(receiver)) {
            return onClass(site, receiver, method, ResolutionReason.CLASS_QUALIFIED);
        }
        if (caller.isMember() && SELF_NAMES.contains(receiver)) {
            return onClass(site, caller.className(), method, ResolutionReason.SELF_RECEIVER);
        }
        if (caller.isMember() && SUPER_CALL.equals(receiver)) {
            return onBases(site, caller.className(), method);
        }
        return byMethodName(site, method);
    }

    private Resolution onClass(CallSite site, String className, String method, ResolutionReason directReason) {
        return lookup(className, method)
                .<Resolution>map(found -> new Resolution.Resolved(site, found.definition(),
                        found.inherited() ? ResolutionReason.INHERITED : directReason))
                .orElseGet(() -> new Resolution.Unresolved(site, Resolution.Cause.NOT_ON_RECEIVER_CLASS));
    }

    private Resolution onBases(CallSite site, String className, String method) {
        Set<String> visited = new HashSet<>();
        visited.add(className);
        for (String base : bases(className)) {
            Optional<Lookup> found = lookup(base, method, visited);
            if (found.isPresent()) {
                return new Resolution.Resolved(site, found.get().definition(), ResolutionReason.INHERITED);
            }
        }
        return new Resolution.Unresolved(site, Resolution.Cause.NOT_ON_RECEIVER_CLASS);
    }

    private Resolution byMethodName(CallSite site, String method) {
        List<String> owners = registry.classesDefining(method);
        if (owners.isEmpty()) {
            return new Resolution.Unresolved(site, Resolution.Cause.UNKNOWN_METHOD);
        }
        List<Definition> candidates = new ArrayList<>(owners.size());
        for (String owner : owners) {
            registry.resolveMethodCall(owner, method).ifPresent(candidates::add);
        }
        if (candidates.size() == 1) {
            return new Resolution.Resolved(site, candidates.get(0), ResolutionReason.UNIQUE_METHOD);
        }
        return new Resolution.AmbiguousFirstMatch(site, candidates.get(0), candidates);
    }

    /**
     * A method found on a class or one of its ancestors.
     */
    record Lookup(Definition definition, boolean inherited) {
    }

    Optional<Lookup> lookup(String className, String method) {
        return lookup(className, method, new HashSet<>());
    }

    private Optional<Lookup> lookup(String className, String method, Set<String> visited) {
        if (!visited.add(className)) {
            return Optional.empty();
        }
        Optional<Definition> direct = registry.resolveMethodCall(className, method);
        if (direct.isPresent()) {
            return Optional.of(new Lookup(direct.get(), false));
        }
        for (String base : bases(className)) {
            Optional<Lookup> found = lookup(base, method, visited);
            if (found.isPresent()) {
                return Optional.of(new Lookup(found.get().definition(), true));
            }
        }
        return Optional.empty();
    }

    private List<String> bases(String className) {
        return registry.classDeclaration(className)
                .map(ClassDeclaration::bases)
                .orElse(List.of());
    }
}
