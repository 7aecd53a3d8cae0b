package io.cflow;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CflowConfigTest {

    @TempDir
    Path dir;

    @Test
    void load_allKeys() throws IOException {
        Path file = write("""
                entry: Service.run
                maxDepth: 4
                entryName: run_app
                excludeDirs: [migrations, " fixtures "]
                excludePatterns: ["**/test_*.py"]
                entryExclusions: ["_*", "test_*"]
                parallelism: 2
                withMermaid: true
                mermaidMaxNodes: 20
                respectGitignore: false
                """);

        CflowConfig config = CflowConfig.load(file);

        assertThat(config.getEntry()).isEqualTo("Service.run");
        assertThat(config.getMaxDepth()).isEqualTo(4);
        assertThat(config.getEntryName()).isEqualTo("run_app");
        assertThat(config.getExcludeDirs()).containsExactly("migrations", "fixtures");
        assertThat(config.getExcludePatterns()).containsExactly("**/test_*.py");
        assertThat(config.getEntryExclusions()).containsExactly("_*", "test_*");
        assertThat(config.getParallelism()).isEqualTo(2);
        assertThat(config.getWithMermaid()).isTrue();
        assertThat(config.getMermaidMaxNodes()).isEqualTo(20);
        assertThat(config.getRespectGitignore()).isFalse();
    }

    @Test
    void load_emptyFileLeavesEverythingUnset() throws IOException {
        CflowConfig config = CflowConfig.load(write(""));

        assertThat(config.getEntry()).isNull();
        assertThat(config.getMaxDepth()).isNull();
        assertThat(config.getExcludeDirs()).isEmpty();
        assertThat(config.getEntryExclusions()).isEmpty();
        assertThat(config.getWithMermaid()).isNull();
    }

    @Test
    void load_rejectsInvalidValues() throws IOException {
        assertThatThrownBy(() -> CflowConfig.load(write("maxDepth: -1\n")))
                .isInstanceOf(IOException.class).hasMessageContaining("maxDepth");
        assertThatThrownBy(() -> CflowConfig.load(write("maxDepth: deep\n")))
                .isInstanceOf(IOException.class).hasMessageContaining("must be an integer");
        assertThatThrownBy(() -> CflowConfig.load(write("parallelism: 0\n")))
                .isInstanceOf(IOException.class).hasMessageContaining("parallelism");
        assertThatThrownBy(() -> CflowConfig.load(write("excludeDirs: vendor\n")))
                .isInstanceOf(IOException.class).hasMessageContaining("must be a list");
        assertThatThrownBy(() -> CflowConfig.load(write("withMermaid: sometimes\n")))
                .isInstanceOf(IOException.class).hasMessageContaining("true or false");
        assertThatThrownBy(() -> CflowConfig.load(write("- just\n- a list\n")))
                .isInstanceOf(IOException.class).hasMessageContaining("mapping");
        assertThatThrownBy(() -> CflowConfig.load(write("entry: [unclosed\n")))
                .isInstanceOf(IOException.class).hasMessageContaining("Invalid YAML");
    }

    @Test
    void loadFromDirectory_missingFileIsEmpty() throws IOException {
        assertThat(CflowConfig.loadFromDirectory(dir).getMaxDepth()).isNull();
        assertThat(CflowConfig.loadFromDirectory(dir.resolve("app.py")).getEntry()).isNull();
    }

    @Test
    void loadFromDirectory_readsDefaultFile() throws IOException {
        write("maxDepth: 2\n");

        assertThat(CflowConfig.loadFromDirectory(dir).getMaxDepth()).isEqualTo(2);
    }

    private Path write(String yaml) throws IOException {
        Path file = dir.resolve(CflowConfig.DEFAULT_FILE_NAME);
        Files.writeString(file, yaml);
        return file;
    }
}
