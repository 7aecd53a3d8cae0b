package io.cflow;

import io.cflow.analysis.AnalysisOptions;
import io.cflow.analysis.AnalysisResult;
import io.cflow.analysis.CallFlowAnalyzer;
import io.cflow.discovery.DiscoveryResult;
import io.cflow.discovery.SourceDiscovery;
import io.cflow.graph.NoEntryPointFoundException;
import io.cflow.graph.TreeMaterializer;
import io.cflow.model.ParseFailure;
import io.cflow.report.ConsoleSummary;
import io.cflow.report.MarkdownReport;
import io.cflow.report.MermaidRenderer;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.regex.PatternSyntaxException;

/**
 * CLI entry point for the cflow tool.
 */
@Command(
        name = "cflow",
        mixinStandardHelpOptions = true,
        version = "cflow 1.0.0",
        description = "Generates function call trees for Python code and writes them as Markdown.",
        footer = {
                "",
                "Examples:",
                "  cflow ./src                          Analyze and write cflow.md",
                "  cflow ./src/main.py                  Analyze a single file",
                "  cflow ./src --entry main             Start from 'main' only",
                "  cflow ./src --with-mermaid           Include a Mermaid diagram",
                "  cflow ./src --stdout                 Print the report instead of writing it"
        }
)
public class CflowCli implements Callable<Integer> {

    static final String DEFAULT_OUTPUT = "cflow.md";

    @Parameters(
            index = "0",
            arity = "0..1",
            defaultValue = ".",
            description = "Directory or file to analyze (default: current directory)"
    )
    private Path path;

    @Option(
            names = {"-e", "--entry"},
            paramLabel = "FUNC",
            description = "Entry point function, qualified (Class.method) or simple name (default: auto-detect)"
    )
    private String entry;

    @Option(
            names = {"-o", "--output"},
            paramLabel = "FILE",
            description = "Output file (default: " + DEFAULT_OUTPUT + ")"
    )
    private Path output;

    @Option(
            names = {"--stdout"},
            description = "Print the report to stdout instead of writing a file"
    )
    private boolean stdout;

    @Option(
            names = {"--with-mermaid"},
            description = "Include a Mermaid diagram in the report"
    )
    private Boolean withMermaid;

    @Option(
            names = {"--max-depth"},
            paramLabel = "N",
            description = "Maximum call depth to expand (default: " + TreeMaterializer.DEFAULT_MAX_DEPTH + ")"
    )
    private Integer maxDepth;

    @Option(
            names = {"-c", "--config"},
            paramLabel = "FILE",
            description = "Path to configuration YAML file (default: " + CflowConfig.DEFAULT_FILE_NAME + " in PATH)"
    )
    private Path configFile;

    @Option(
            names = {"-x", "--exclude"},
            paramLabel = "GLOB",
            description = "Glob patterns of files to skip, relative to PATH (e.g. '**/test_*.py')",
            split = ","
    )
    private List<String> excludePatterns;

    @Option(
            names = {"-j", "--jobs"},
            paramLabel = "N",
            description = "Number of files parsed in parallel (default: available processors)"
    )
    private Integer jobs;

    @Option(
            names = {"-q", "--quiet"},
            description = "Suppress progress messages"
    )
    private boolean quiet;

    @Option(
            names = {"-v", "--verbose"},
            description = "Also list skipped files and unresolved callees"
    )
    private boolean verbose;

    @Option(
            names = {"--no-color"},
            description = "Disable ANSI colors in console output"
    )
    private boolean noColor;

    private final PrintStream out;
    private final PrintStream err;

    public CflowCli() {
        this(System.out, System.err);
    }

    CflowCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    @Override
    public Integer call() {
        if (!Files.exists(path)) {
            err.println("Error: '" + path + "' is not a valid path");
            return 1;
        }
        boolean silent = quiet || stdout;

        CflowConfig config;
        try {
            config = loadConfig();
        } catch (IOException e) {
            err.println("Error loading config: " + e.getMessage());
            return 1;
        }

        int depth = firstNonNull(maxDepth, config.getMaxDepth(), TreeMaterializer.DEFAULT_MAX_DEPTH);
        if (depth < 0) {
            err.println("Error: --max-depth must be >= 0, got " + depth);
            return 1;
        }
        int parallelism = firstNonNull(jobs, config.getParallelism(), Runtime.getRuntime().availableProcessors());
        if (parallelism < 1) {
            err.println("Error: --jobs must be >= 1, got " + parallelism);
            return 1;
        }
        String entryName = entry != null ? entry : config.getEntry();
        boolean mermaid = firstNonNull(withMermaid, config.getWithMermaid(), false);

        if (!silent) {
            out.println("> Scanning: " + path.toAbsolutePath().normalize());
            if (entryName != null) {
                out.println("> Entry point: " + entryName);
            }
            if (depth != TreeMaterializer.DEFAULT_MAX_DEPTH) {
                out.println("> Max depth: " + depth);
            }
            if (mermaid) {
                out.println("> Including Mermaid diagram");
            }
        }

        List<String> excludes = new ArrayList<>(config.getExcludePatterns());
        if (excludePatterns != null) {
            excludes.addAll(excludePatterns);
        }
        SourceDiscovery discovery;
        try {
            discovery = new SourceDiscovery(config.getExcludeDirs(), excludes,
                    firstNonNull(config.getRespectGitignore(), null, true));
        } catch (PatternSyntaxException e) {
            err.println("Error: invalid exclude pattern '" + e.getPattern() + "'");
            return 1;
        }
        DiscoveryResult discovered;
        try {
            discovered = discovery.discover(path);
        } catch (IOException e) {
            err.println("Error reading " + path + ": " + e.getMessage());
            return 1;
        }
        if (discovered.files().isEmpty()) {
            out.println("No functions found");
            return 0;
        }

        AnalysisOptions options = AnalysisOptions.builder()
                .entryName(entryName)
                .reservedName(config.getEntryName())
                .maxDepth(depth)
                .entryExclusions(config.getEntryExclusions())
                .parallelism(parallelism)
                .build();

        AnalysisResult result;
        try {
            result = new CallFlowAnalyzer(options).analyze(discovered.files());
        } catch (NoEntryPointFoundException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        if (!result.hasDefinitions()) {
            out.println("No functions found");
            return 0;
        }
        if (result.entryPoints().isEmpty()) {
            out.println("Warning: No entry points found, use --entry to pick one");
            return 0;
        }

        ConsoleSummary summary = new ConsoleSummary(out, !noColor);
        if (!silent) {
            summary.print(result);
        }
        if (verbose && !stdout) {
            List<ParseFailure> skipped = new ArrayList<>(discovered.unreadable());
            skipped.addAll(result.failures());
            summary.printFailures(skipped);
            if (!result.stats().externalCalls().isEmpty()) {
                out.println("Unresolved callees: " + String.join(", ", result.stats().externalCalls()));
            }
        }

        int mermaidMaxNodes = firstNonNull(config.getMermaidMaxNodes(), null, MermaidRenderer.DEFAULT_MAX_NODES);
        String report = new MarkdownReport(mermaid, mermaidMaxNodes)
                .render(result, path.toAbsolutePath().normalize().toString());

        if (stdout) {
            out.println(report);
            return 0;
        }
        Path target = output != null ? output : Path.of(DEFAULT_OUTPUT);
        try {
            Files.writeString(target, report, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Error writing " + target + ": " + e.getMessage());
            return 1;
        }
        if (!silent) {
            out.println("> Generated " + target);
        }
        return 0;
    }

    private CflowConfig loadConfig() throws IOException {
        if (configFile != null) {
            if (!Files.isRegularFile(configFile)) {
                throw new IOException("Config file does not exist: " + configFile);
            }
            return CflowConfig.load(configFile);
        }
        return CflowConfig.loadFromDirectory(path);
    }

    private static <T> T firstNonNull(T cli, T config, T fallback) {
        if (cli != null) {
            return cli;
        }
        return config != null ? config : fallback;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CflowCli()).execute(args);
        System.exit(exitCode);
    }
}
