package io.cflow;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static io.cflow.PythonFixtures.testProject;
import static org.assertj.core.api.Assertions.assertThat;

class CflowCliTest {

    @TempDir
    Path workDir;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    @Test
    void writesReportFile() throws IOException {
        Path report = workDir.resolve("report.md");

        int exitCode = run(testProject("service-app").toString(), "-o", report.toString(), "--no-color");

        assertThat(exitCode).isZero();
        String markdown = Files.readString(report);
        assertThat(markdown).startsWith("# Call Graph\n");
        assertThat(markdown).contains("**Functions:** 9  ", "**Call Edges:** 9",
                "│       └── Service.run (recursive) (service.py:19)");
        assertThat(markdown).doesNotContain("```mermaid");
        assertThat(stdout()).contains("> Scanning: ", "Call Graph Analysis", "> Generated " + report);
    }

    @Test
    void stdoutPrintsOnlyTheReport() throws IOException {
        int exitCode = run(testProject("service-app").toString(), "--stdout", "--entry", "report");

        assertThat(exitCode).isZero();
        assertThat(stdout()).startsWith("# Call Graph\n");
        assertThat(stdout()).contains("report (app.py:10)").doesNotContain("> Scanning", "main (app.py:4)");
    }

    @Test
    void withMermaidAddsDiagram() throws IOException {
        int exitCode = run(testProject("service-app").toString(), "--stdout", "--with-mermaid");

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("## Call Graph Diagram", "main --> Service___init__");
    }

    @Test
    void missingPathFails() {
        int exitCode = run(workDir.resolve("nope").toString(), "--stdout");

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).contains("is not a valid path");
    }

    @Test
    void unknownEntryFails() throws IOException {
        int exitCode = run(testProject("service-app").toString(), "--stdout", "-e", "missing");

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).contains("Error: Entry point 'missing' not found");
    }

    @Test
    void emptyDirectoryFindsNothing() {
        int exitCode = run(workDir.toString(), "--stdout");

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("No functions found");
    }

    @Test
    void configFileSetsDepth() throws IOException {
        writeApp();
        Files.writeString(workDir.resolve(CflowConfig.DEFAULT_FILE_NAME), "maxDepth: 0\n");

        int exitCode = run(workDir.toString(), "--stdout");

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("main (app.py:1)\n└── ...\n");
    }

    @Test
    void commandLineOverridesConfig() throws IOException {
        writeApp();
        Files.writeString(workDir.resolve(CflowConfig.DEFAULT_FILE_NAME), "maxDepth: 0\n");

        int exitCode = run(workDir.toString(), "--stdout", "--max-depth", "3");

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("main (app.py:1)\n└── helper (app.py:5)\n");
    }

    @Test
    void negativeDepthFails() throws IOException {
        writeApp();

        int exitCode = run(workDir.toString(), "--stdout", "--max-depth=-1");

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).contains("--max-depth");
    }

    @Test
    void malformedExcludeFails() throws IOException {
        writeApp();

        int exitCode = run(workDir.toString(), "--stdout", "-x", "tests/[abc");

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).contains("invalid exclude pattern");
    }

    @Test
    void invalidConfigFails() throws IOException {
        writeApp();
        Files.writeString(workDir.resolve(CflowConfig.DEFAULT_FILE_NAME), "maxDepth: deep\n");

        int exitCode = run(workDir.toString(), "--stdout");

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).startsWith("Error loading config: ");
    }

    @Test
    void brokenFileIsSkippedAndListedWhenVerbose() throws IOException {
        Path report = workDir.resolve("out.md");

        int exitCode = run(testProject("broken-file").toString(), "-v", "--no-color", "-o", report.toString());

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("Skipped bad.py (syntax error at line ");
        assertThat(Files.readString(report)).contains("main (good.py:1)\n└── helper (good.py:5)");
    }

    private void writeApp() throws IOException {
        Files.writeString(workDir.resolve("app.py"), """
                def main():
                    helper()


                def helper():
                    pass
                """);
    }

    private int run(String... args) {
        CflowCli cli = new CflowCli(
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
        return new CommandLine(cli).execute(args);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }
}
