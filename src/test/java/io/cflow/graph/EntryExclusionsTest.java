package io.cflow.graph;

import org.junit.jupiter.api.Test;

import java.util.List;

import static io.cflow.TestDefinitions.function;
import static io.cflow.TestDefinitions.method;
import static org.assertj.core.api.Assertions.assertThat;

class EntryExclusionsTest {

    @Test
    void prefixAndExactPatterns() {
        EntryExclusions exclusions = new EntryExclusions(List.of("test_*", "Service.run", "setup"));

        assertThat(exclusions.excludes(function("test_save", "t.py", 1))).isTrue();
        assertThat(exclusions.excludes(method("Service", "run", "s.py", 2))).isTrue();
        assertThat(exclusions.excludes(method("Worker", "run", "s.py", 9))).isFalse();
        assertThat(exclusions.excludes(function("setup", "a.py", 1))).isTrue();
        assertThat(exclusions.excludes(function("main", "a.py", 5))).isFalse();
    }

    @Test
    void noneExcludesNothing() {
        assertThat(EntryExclusions.none().excludes(function("_private", "a.py", 1))).isFalse();
        assertThat(EntryExclusions.none().patterns()).isEmpty();
    }
}
