package com.questrail.l5x.pipeline;

import com.questrail.l5x.graph.TransitionGraph;
import com.questrail.l5x.naming.StateNameTable;
import com.questrail.l5x.render.DiagramDocument;
import com.questrail.l5x.section.LocatedSection;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything the compile stages produce for one project, before any output
 * is written.
 */
public record CompiledDiagram(
        LocatedSection section,
        Optional<String> stateTag,
        TransitionGraph graph,
        StateNameTable names,
        DiagramDocument document,
        List<String> warnings
) {
    public CompiledDiagram {
        Objects.requireNonNull(section, "section");
        Objects.requireNonNull(stateTag, "stateTag");
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(names, "names");
        Objects.requireNonNull(document, "document");
        warnings = List.copyOf(Objects.requireNonNull(warnings, "warnings"));
    }
}
