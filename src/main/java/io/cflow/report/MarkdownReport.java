package io.cflow.report;

import io.cflow.analysis.AnalysisResult;

import java.util.ArrayList;
import java.util.List;

/**
 * The Markdown document written by the command line tool.
 */
public class MarkdownReport {
    private final TextTreeRenderer treeRenderer = new TextTreeRenderer();
    private final MermaidRenderer mermaidRenderer;
    private final boolean withMermaid;

    public MarkdownReport(boolean withMermaid) {
        this(withMermaid, MermaidRenderer.DEFAULT_MAX_NODES);
    }

    public MarkdownReport(boolean withMermaid, int mermaidMaxNodes) {
        this.withMermaid = withMermaid;
        this.mermaidRenderer = new MermaidRenderer(mermaidMaxNodes);
    }

    /**
     * @param result      The analysis to describe
     * @param sourceLabel How the analyzed path is shown in the header
     */
    public String render(AnalysisResult result, String sourceLabel) {
        List<String> lines = new ArrayList<>();
        lines.add("# Call Graph");
        lines.add("");
        lines.add("**Source:** `" + sourceLabel + "`  ");
        lines.add("**Functions:** " + result.summary().definitions() + "  ");
        lines.add("**Entry Points:** " + result.summary().entryPoints() + "  ");
        lines.add("**Call Edges:** " + result.summary().callEdges());
        lines.add("");

        lines.add("## Call Tree");
        lines.add("");
        lines.add("```");
        lines.add(treeRenderer.render(result.trees()));
        lines.add("```");
        lines.add("");

        if (withMermaid) {
            lines.add("## Call Graph Diagram");
            lines.add("");
            lines.add(mermaidRenderer.render(result.trees()));
            lines.add("");
        }
        return String.join("\n", lines);
    }
}
