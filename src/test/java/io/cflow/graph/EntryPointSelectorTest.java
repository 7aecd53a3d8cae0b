package io.cflow.graph;

import io.cflow.model.Definition;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.cflow.TestDefinitions.edge;
import static io.cflow.TestDefinitions.function;
import static io.cflow.TestDefinitions.method;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EntryPointSelectorTest {

    private final Definition setup = function("setup", "app.py", 1);
    private final Definition main = function("main", "app.py", 5);
    private final Definition run = method("Service", "run", "service.py", 8);
    private final Definition helper = function("helper", "util.py", 1);
    private final Definition testRun = function("test_run", "test_app.py", 1);

    @Test
    void automatic_mainFirstThenUncalled() {
        CallGraph graph = new CallGraph(List.of(setup, main, run, helper),
                List.of(edge(main, run), edge(run, helper)));

        List<EntryPoint> entries = new EntryPointSelector(graph).selectAutomatic();

        assertThat(entries).extracting(e -> e.definition().qualifiedName()).containsExactly("main", "setup");
        assertThat(entries).extracting(EntryPoint::reason)
                .containsExactly(EntryPoint.Reason.NAMED_MAIN, EntryPoint.Reason.UNCALLED);
    }

    @Test
    void automatic_mainIsEntryEvenWhenCalled() {
        CallGraph graph = new CallGraph(List.of(setup, main), List.of(edge(setup, main)));

        List<EntryPoint> entries = new EntryPointSelector(graph).selectAutomatic();

        assertThat(entries).extracting(e -> e.definition().qualifiedName()).containsExactly("main", "setup");
    }

    @Test
    void automatic_methodNamedMainIsNotReserved() {
        Definition appMain = method("App", "main", "app.py", 3);
        CallGraph graph = new CallGraph(List.of(setup, appMain), List.of(edge(setup, appMain)));

        List<EntryPoint> entries = new EntryPointSelector(graph).selectAutomatic();

        assertThat(entries).extracting(e -> e.definition().qualifiedName()).containsExactly("setup");
    }

    @Test
    void automatic_selfRecursiveFunctionIsStillUncalled() {
        CallGraph graph = new CallGraph(List.of(helper), List.of(edge(helper, helper)));

        assertThat(new EntryPointSelector(graph).selectAutomatic())
                .extracting(e -> e.definition().qualifiedName())
                .containsExactly("helper");
    }

    @Test
    void automatic_honorsExclusionsAndReservedName() {
        CallGraph graph = new CallGraph(List.of(setup, main, testRun), List.of());
        EntryExclusions exclusions = new EntryExclusions(List.of("test_*", "main"));

        List<EntryPoint> entries = new EntryPointSelector(graph, "setup", exclusions).selectAutomatic();

        assertThat(entries).extracting(e -> e.definition().qualifiedName()).containsExactly("setup");
        assertThat(entries.get(0).reason()).isEqualTo(EntryPoint.Reason.NAMED_MAIN);
    }

    @Test
    void automatic_emptyWhenEverythingIsCalledInACycle() {
        CallGraph graph = new CallGraph(List.of(run, helper), List.of(edge(run, helper), edge(helper, run)));

        assertThat(new EntryPointSelector(graph).selectAutomatic()).isEmpty();
    }

    @Test
    void explicit_qualifiedNameThenSimpleName() throws NoEntryPointFoundException {
        CallGraph graph = new CallGraph(List.of(main, run, helper), List.of(edge(main, run)));
        EntryPointSelector selector = new EntryPointSelector(graph);

        assertThat(selector.select("Service.run")).singleElement()
                .satisfies(e -> assertThat(e.definition()).isEqualTo(run))
                .satisfies(e -> assertThat(e.reason()).isEqualTo(EntryPoint.Reason.EXPLICIT));
        assertThat(selector.select("run")).extracting(EntryPoint::definition).containsExactly(run);
        assertThat(selector.select("  helper ")).extracting(EntryPoint::definition).containsExactly(helper);
    }

    @Test
    void explicit_firstMatchWins() throws NoEntryPointFoundException {
        Definition otherHelper = function("helper", "other.py", 1);
        CallGraph graph = new CallGraph(List.of(helper, otherHelper), List.of());

        EntryPoint entry = new EntryPointSelector(graph).selectExplicit("helper");

        assertThat(entry.definition()).isEqualTo(helper);
    }

    @Test
    void explicit_unknownNameThrows() {
        CallGraph graph = new CallGraph(List.of(main), List.of());

        assertThatThrownBy(() -> new EntryPointSelector(graph).select("missing"))
                .isInstanceOf(NoEntryPointFoundException.class)
                .hasMessage("Entry point 'missing' not found");
    }

    @Test
    void blankNameSelectsAutomatically() throws NoEntryPointFoundException {
        CallGraph graph = new CallGraph(List.of(main), List.of());

        assertThat(new EntryPointSelector(graph).select(" ")).extracting(EntryPoint::reason)
                .containsExactly(EntryPoint.Reason.NAMED_MAIN);
    }
}
