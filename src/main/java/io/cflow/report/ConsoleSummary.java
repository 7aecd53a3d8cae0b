package io.cflow.report;

import io.cflow.analysis.AnalysisResult;
import io.cflow.analysis.AnalysisSummary;
import io.cflow.model.ParseFailure;

import java.io.PrintStream;
import java.util.List;

/**
 * Prints the headline numbers of a run to the terminal.
 */
public class ConsoleSummary {
    private static final String RESET = "\u001B[0m";
    private static final String BOLD = "\u001B[1m";
    private static final String CYAN = "\u001B[36m";
    private static final String YELLOW = "\u001B[33m";
    private static final String DIM = "\u001B[2m";

    private final PrintStream out;
    private final boolean useColor;

    public ConsoleSummary(PrintStream out, boolean useColor) {
        this.out = out;
        this.useColor = useColor;
    }

    public void print(AnalysisResult result) {
        AnalysisSummary summary = result.summary();
        out.println(color(BOLD + CYAN, "Call Graph Analysis"));
        row("Total functions", summary.definitions());
        row("Classes", summary.classes());
        row("Entry points", summary.entryPoints());
        row("Call edges", summary.callEdges());
        row("Resolved calls", summary.resolvedCalls());
        row("Unresolved calls", summary.unresolvedCalls());
        if (summary.ambiguousCalls() > 0) {
            row("Ambiguous calls", summary.ambiguousCalls());
        }
        row("Files analyzed", summary.filesAnalyzed());
        if (summary.parseFailures() > 0) {
            row("Files skipped", summary.parseFailures());
        }
    }

    /**
     * List files that were skipped, one per line.
     */
    public void printFailures(List<ParseFailure> failures) {
        for (ParseFailure failure : failures) {
            out.println(color(YELLOW, "Skipped ") + failure.file() + color(DIM, " (" + failure.reason() + ")"));
        }
    }

    private void row(String metric, int value) {
        out.println("  " + color(DIM, String.format("%-18s", metric)) + " " + color(BOLD, String.valueOf(value)));
    }

    private String color(String code, String text) {
        return useColor ? code + text + RESET : text;
    }
}
