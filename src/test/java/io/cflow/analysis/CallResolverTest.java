package io.cflow.analysis;

import io.cflow.model.Assignment;
import io.cflow.model.Definition;
import io.cflow.model.ExtractedDefinition;
import io.cflow.model.ExtractedFile;
import io.cflow.model.ResolutionReason;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.cflow.PythonFixtures.extract;
import static org.assertj.core.api.Assertions.assertThat;

class CallResolverTest {

    private static final String REPOSITORY = """
            class Repository:
                def __init__(self):
                    pass

                def save(self):
                    self._write()

                def _write(self):
                    pass


            class Cache:
                def save(self):
                    pass
            """;

    @Test
    void resolve_bareClassNameIsConstructor() {
        List<Resolution> resolutions = resolve(REPOSITORY + """

                def main():
                    Repository()
                """, "main");

        assertResolved(resolutions.get(0), "Repository.__init__", ResolutionReason.CONSTRUCTOR);
    }

    @Test
    void resolve_bareNameIsModuleFunctionOrUnknown() {
        List<Resolution> resolutions = resolve("""
                def helper():
                    pass


                def main():
                    helper()
                    print("done")
                """, "main");

        assertResolved(resolutions.get(0), "helper", ResolutionReason.MODULE_FUNCTION);
        assertUnresolved(resolutions.get(1), Resolution.Cause.UNKNOWN_NAME);
    }

    @Test
    void resolve_trackedReceiverUsesBoundClass() {
        List<Resolution> resolutions = resolve(REPOSITORY + """

                def main():
                    repo = Repository()
                    repo.save()
                """, "main");

        assertResolved(resolutions.get(1), "Repository.save", ResolutionReason.TRACKED_RECEIVER);
    }

    @Test
    void resolve_bindingOnlyAffectsLaterCalls() {
        List<Resolution> resolutions = resolve(REPOSITORY + """

                def main():
                    repo.save()
                    repo = Cache()
                    repo.save()
                """, "main");

        assertThat(resolutions.get(0)).isInstanceOf(Resolution.AmbiguousFirstMatch.class);
        assertResolved(resolutions.get(2), "Cache.save", ResolutionReason.TRACKED_RECEIVER);
    }

    @Test
    void resolve_reassignmentToUnknownValueClearsBinding() {
        List<Resolution> resolutions = resolve(REPOSITORY + """

                def main(factory):
                    repo = Cache()
                    repo = factory()
                    repo.save()
                """, "main");

        Resolution last = resolutions.get(2);
        assertThat(last).isInstanceOf(Resolution.AmbiguousFirstMatch.class);
        Resolution.AmbiguousFirstMatch ambiguous = (Resolution.AmbiguousFirstMatch) last;
        assertThat(ambiguous.target().qualifiedName()).isEqualTo("Repository.save");
        assertThat(ambiguous.candidates()).extracting(Definition::qualifiedName)
                .containsExactly("Repository.save", "Cache.save");
        assertThat(last.resolvedBy()).contains(ResolutionReason.AMBIGUOUS_FIRST_MATCH);
    }

    @Test
    void resolve_loopVariableReplacesBinding() {
        List<Resolution> resolutions = resolve(REPOSITORY + """

                def main(items):
                    repo = Cache()
                    for repo in items:
                        repo.save()
                """, "main");

        assertThat(resolutions.get(1)).isInstanceOf(Resolution.AmbiguousFirstMatch.class);
    }

    @Test
    void resolve_withAliasReplacesBinding() {
        List<Resolution> resolutions = resolve(REPOSITORY + """

                def main(path):
                    repo = Cache()
                    with open(path) as repo:
                        repo.save()
                """, "main");

        assertUnresolved(resolutions.get(1), Resolution.Cause.UNKNOWN_NAME);
        assertThat(resolutions.get(2)).isInstanceOf(Resolution.AmbiguousFirstMatch.class);
    }

    @Test
    void resolve_exceptAliasReplacesBinding() {
        List<Resolution> resolutions = resolve(REPOSITORY + """

                def main():
                    repo = Cache()
                    try:
                        pass
                    except ValueError as repo:
                        repo.save()
                """, "main");

        assertThat(resolutions.get(1)).isInstanceOf(Resolution.AmbiguousFirstMatch.class);
    }

    @Test
    void resolve_walrusBindsConstructedClass() {
        List<Resolution> resolutions = resolve(REPOSITORY + """

                def main():
                    repo = Cache()
                    if (repo := Repository()):
                        repo.save()
                """, "main");

        assertResolved(resolutions.get(1), "Repository.__init__", ResolutionReason.CONSTRUCTOR);
        assertResolved(resolutions.get(2), "Repository.save", ResolutionReason.TRACKED_RECEIVER);
    }

    @Test
    void resolve_augmentedAssignmentClearsBinding() {
        List<Resolution> resolutions = resolve(REPOSITORY + """

                def main(other):
                    repo = Cache()
                    repo += other
                    repo.save()
                """, "main");

        assertThat(resolutions.get(1)).isInstanceOf(Resolution.AmbiguousFirstMatch.class);
    }

    @Test
    void resolve_chainedCallsInEvaluationOrder() {
        List<Resolution> resolutions = resolve(REPOSITORY + """

                def main():
                    Repository().save()
                """, "main");

        assertResolved(resolutions.get(0), "Repository.__init__", ResolutionReason.CONSTRUCTOR);
        assertThat(resolutions.get(1)).isInstanceOf(Resolution.AmbiguousFirstMatch.class);
    }

    @Test
    void resolve_classQualifiedCall() {
        List<Resolution> resolutions = resolve(REPOSITORY + """

                def main(repo):
                    Repository.save(repo)
                """, "main");

        assertResolved(resolutions.get(0), "Repository.save", ResolutionReason.CLASS_QUALIFIED);
    }

    @Test
    void resolve_selfReceiverUsesEnclosingClass() {
        List<Resolution> resolutions = resolve(REPOSITORY, "Repository.save");

        assertResolved(resolutions.get(0), "Repository._write", ResolutionReason.SELF_RECEIVER);
    }

    @Test
    void resolve_selfOutsideMethodFallsBackToMethodName() {
        List<Resolution> resolutions = resolve(REPOSITORY + """

                def main(self):
                    self._write()
                """, "main");

        assertResolved(resolutions.get(0), "Repository._write", ResolutionReason.UNIQUE_METHOD);
    }

    @Test
    void resolve_inheritedMethodAndSuperCall() {
        String code = """
                class Shape:
                    def __init__(self, name):
                        self.name = name

                    def describe(self):
                        return self.name


                class Circle(Shape):
                    def __init__(self):
                        super().__init__("circle")
                        self.describe()


                class Square(Shape):
                    pass


                def main():
                    c = Circle()
                    c.describe()
                    Square()
                """;

        List<Resolution> init = resolve(code, "Circle.__init__");
        assertUnresolved(init.get(0), Resolution.Cause.UNKNOWN_NAME);
        assertResolved(init.get(1), "Shape.__init__", ResolutionReason.INHERITED);
        assertResolved(init.get(2), "Shape.describe", ResolutionReason.INHERITED);

        List<Resolution> main = resolve(code, "main");
        assertResolved(main.get(0), "Circle.__init__", ResolutionReason.CONSTRUCTOR);
        assertResolved(main.get(1), "Shape.describe", ResolutionReason.INHERITED);
        assertResolved(main.get(2), "Shape.__init__", ResolutionReason.CONSTRUCTOR);
    }

    @Test
    void resolve_uniqueMethodByName() {
        List<Resolution> resolutions = resolve(REPOSITORY + """

                def main(store):
                    store._write()
                """, "main");

        assertResolved(resolutions.get(0), "Repository._write", ResolutionReason.UNIQUE_METHOD);
        assertThat(resolutions.get(0).resolvedBy()).hasValueSatisfying(r -> assertThat(r.isGuess()).isFalse());
    }

    @Test
    void resolve_knownReceiverWithoutMethodStaysUnresolved() {
        List<Resolution> resolutions = resolve(REPOSITORY + """

                def main():
                    cache = Cache()
                    cache._write()
                """, "main");

        assertUnresolved(resolutions.get(1), Resolution.Cause.NOT_ON_RECEIVER_CLASS);
    }

    @Test
    void resolve_unknownMethodAndDynamicCallee() {
        List<Resolution> resolutions = resolve(REPOSITORY + """

                def main(client, handlers):
                    client.fetch()
                    handlers["save"]()
                """, "main");

        assertUnresolved(resolutions.get(0), Resolution.Cause.UNKNOWN_METHOD);
        assertUnresolved(resolutions.get(1), Resolution.Cause.DYNAMIC_CALLEE);
    }

    @Test
    void resolve_classWithoutConstructor() {
        List<Resolution> resolutions = resolve("""
                class Plain:
                    pass


                def main():
                    Plain()
                """, "main");

        assertUnresolved(resolutions.get(0), Resolution.Cause.NO_CONSTRUCTOR);
        assertThat(resolutions.get(0).chosen()).isEmpty();
    }

    @Test
    void resolve_bindingsDoNotLeakAcrossBodies() {
        String code = REPOSITORY + """

                def first():
                    repo = Cache()


                def second():
                    repo.save()
                """;

        List<Resolution> resolutions = resolve(code, "second");

        assertThat(resolutions.get(0)).isInstanceOf(Resolution.AmbiguousFirstMatch.class);
    }

    @Test
    void apply_bindsOnlyKnownClasses() {
        ScopeRegistry registry = new ScopeRegistry();
        registry.register(extract("repo.py", REPOSITORY));
        CallResolver resolver = new CallResolver(registry);
        VariableBindings bindings = new VariableBindings();

        resolver.apply(new Assignment("repo", "Repository", 0), bindings);
        resolver.apply(new Assignment("other", "dict", 1), bindings);

        assertThat(bindings.classOf("repo")).contains("Repository");
        assertThat(bindings.classOf("other")).isEmpty();
        assertThat(bindings.size()).isEqualTo(1);
    }

    private static List<Resolution> resolve(String code, String qualifiedName) {
        ExtractedFile file = extract("app.py", code);
        ScopeRegistry registry = new ScopeRegistry();
        registry.register(file);
        ExtractedDefinition body = file.definitions().stream()
                .filter(d -> d.definition().qualifiedName().equals(qualifiedName))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No definition " + qualifiedName));
        return new CallResolver(registry).resolveBody(body);
    }

    private static void assertResolved(Resolution resolution, String qualifiedName, ResolutionReason reason) {
        assertThat(resolution).isInstanceOf(Resolution.Resolved.class);
        assertThat(resolution.chosen()).map(Definition::qualifiedName).contains(qualifiedName);
        assertThat(resolution.resolvedBy()).contains(reason);
    }

    private static void assertUnresolved(Resolution resolution, Resolution.Cause cause) {
        assertThat(resolution).isInstanceOf(Resolution.Unresolved.class);
        assertThat(((Resolution.Unresolved) resolution).cause()).isEqualTo(cause);
        assertThat(resolution.isResolved()).isFalse();
    }
}
