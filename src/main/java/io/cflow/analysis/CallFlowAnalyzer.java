package io.cflow.analysis;

import io.cflow.extract.DefinitionExtractor;
import io.cflow.graph.*;
import io.cflow.model.*;
import io.cflow.parser.ParseException;
import io.cflow.parser.ParsedModule;
import io.cflow.parser.PythonParser;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the whole analysis over a set of source files.
 * <p>
 * Phases:
 * <ol>
 *   <li>Collect: parse and extract every file, in parallel.</li>
 *   <li>Register: once all files are collected, fill the {@link ScopeRegistry} in file order.</li>
 *   <li>Resolve: resolve every call site against the complete registry and build the graph.</li>
 *   <li>Select entry points and materialize one call tree per entry point.</li>
 * </ol>
 * Registration waits for every file because a call in one file may target a
 * class defined in a file collected later.
 */
public class CallFlowAnalyzer {
    private static final Logger log = LogManager.getLogger(CallFlowAnalyzer.class);

    private final AnalysisOptions options;
    private final PythonParser parser = new PythonParser();
    private final DefinitionExtractor extractor = new DefinitionExtractor();

    public CallFlowAnalyzer(AnalysisOptions options) {
        this.options = options;
    }

    /**
     * Analyze the given files.
     *
     * @param files source files in discovery order; that order decides which duplicate name wins
     * @throws NoEntryPointFoundException if an explicit entry point was requested and not found
     */
    public AnalysisResult analyze(List<SourceFile> files) throws NoEntryPointFoundException {
        List<FileOutcome> outcomes = collect(files);

        List<ExtractedFile> extracted = new ArrayList<>();
        List<ParseFailure> failures = new ArrayList<>();
        for (FileOutcome outcome : outcomes) {
            if (outcome.failure() != null) {
                failures.add(outcome.failure());
            } else {
                extracted.add(outcome.extracted());
            }
        }

        ScopeRegistry registry = new ScopeRegistry();
        for (ExtractedFile file : extracted) {
            registry.register(file);
        }
        if (!registry.shadowed().isEmpty()) {
            log.info("{} definitions shadowed by earlier ones with the same name", registry.shadowed().size());
        }

        CallGraphBuilder builder = new CallGraphBuilder();
        registry.definitions().forEach(builder::addNode);

        CallResolver resolver = new CallResolver(registry);
        ResolutionStats stats = new ResolutionStats();
        for (ExtractedFile file : extracted) {
            for (ExtractedDefinition body : file.definitions()) {
                for (Resolution resolution : resolver.resolveBody(body)) {
                    stats.record(resolution);
                    builder.addCall(body.definition(), resolution);
                }
            }
        }
        CallGraph graph = builder.build();
        log.debug("Resolved {} call sites, {} unresolved", stats.resolvedCount(), stats.unresolvedCount());

        EntryPointSelector selector = new EntryPointSelector(graph, options.reservedName(),
                new EntryExclusions(options.entryExclusions()));
        List<EntryPoint> entryPoints = selector.select(options.entryName());
        List<CallTree> trees = new TreeMaterializer(graph, options.maxDepth()).materializeAll(entryPoints);

        AnalysisSummary summary = new AnalysisSummary(
                extracted.size(),
                failures.size(),
                registry.classCount(),
                graph.nodeCount(),
                entryPoints.size(),
                graph.edgeCount(),
                stats.resolvedCount(),
                stats.unresolvedCount(),
                stats.ambiguousCount());
        log.info("Analyzed {} files: {} definitions, {} call edges, {} entry points",
                summary.filesAnalyzed(), summary.definitions(), summary.callEdges(), summary.entryPoints());
        return new AnalysisResult(graph, entryPoints, trees, failures, stats, summary);
    }

    /**
     * Either an extracted file or the reason it was skipped.
     */
    private record FileOutcome(ExtractedFile extracted, ParseFailure failure) {
    }

    private List<FileOutcome> collect(List<SourceFile> files) {
        int threads = Math.min(options.parallelism(), files.size());
        if (threads <= 1) {
            List<FileOutcome> outcomes = new ArrayList<>(files.size());
            for (SourceFile file : files) {
                outcomes.add(process(file));
            }
            return outcomes;
        }

        ExecutorService executor = Executors.newFixedThreadPool(threads, workerThreads());
        try {
            List<Future<FileOutcome>> futures = new ArrayList<>(files.size());
            for (SourceFile file : files) {
                futures.add(executor.submit(() -> process(file)));
            }
            // Gathered by index so the registration order does not depend on scheduling
            List<FileOutcome> outcomes = new ArrayList<>(files.size());
            for (Future<FileOutcome> future : futures) {
                outcomes.add(await(future));
            }
            return outcomes;
        } finally {
            executor.shutdownNow();
        }
    }

    private FileOutcome process(SourceFile file) {
        try {
            ParsedModule module = parser.parse(file);
            ExtractedFile extracted = extractor.extract(module);
            log.debug("{}: {} definitions, {} call sites",
                    file.path(), extracted.definitions().size(), extracted.callSiteCount());
            return new FileOutcome(extracted, null);
        } catch (ParseException e) {
            log.warn("Skipping {}: {}", file.path(), e.getMessage());
            String reason = e.getLine() > 0 ? "syntax error at line " + e.getLine() : e.getMessage();
            return new FileOutcome(null, new ParseFailure(file.path(), reason));
        } catch (RuntimeException | StackOverflowError e) {
            log.warn("Skipping {}: extraction failed", file.path(), e);
            return new FileOutcome(null, new ParseFailure(file.path(), "extraction failed: " + e));
        }
    }

    private static FileOutcome await(Future<FileOutcome> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while parsing source files", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException("Parsing failed", cause);
        }
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "cflow-parser-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
