package com.questrail.l5x.render;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A rendered diagram: front matter and declaration, node lines, edge lines.
 *
 * <p>{@link #text()} joins header, nodes, one blank separator line and edges
 * with {@code \n}. An empty graph still produces the header and the
 * separator.</p>
 */
public record DiagramDocument(
        DiagramGrammar grammar,
        String title,
        List<String> headerLines,
        List<String> nodeLines,
        List<String> edgeLines
) {
    public DiagramDocument {
        Objects.requireNonNull(grammar, "grammar");
        Objects.requireNonNull(title, "title");
        headerLines = List.copyOf(Objects.requireNonNull(headerLines, "headerLines"));
        nodeLines = List.copyOf(Objects.requireNonNull(nodeLines, "nodeLines"));
        edgeLines = List.copyOf(Objects.requireNonNull(edgeLines, "edgeLines"));
    }

    public List<String> lines() {
        List<String> lines = new ArrayList<>(headerLines.size() + nodeLines.size() + edgeLines.size() + 1);
        lines.addAll(headerLines);
        lines.addAll(nodeLines);
        lines.add("");
        lines.addAll(edgeLines);
        return lines;
    }

    public String text() {
        return String.join("\n", lines());
    }
}
