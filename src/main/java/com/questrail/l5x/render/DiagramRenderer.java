package com.questrail.l5x.render;

import com.questrail.l5x.graph.TransitionGraph;
import com.questrail.l5x.naming.StateNameTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;

/**
 * DiagramRenderer
 * -----------------------------------------------------------------------------
 * Serializes a {@link TransitionGraph} into Mermaid text.
 *
 * <h2>Ordering</h2>
 * Nodes are emitted by ascending id; edges by ascending source, then ascending
 * target. Output for a given graph and name table is byte-identical across
 * runs, which keeps generated documents diffable.
 *
 * <h2>Line shapes</h2>
 * <pre>
 *   flowchart:      S4[State 4, Wait For Clamp]     S3 --&gt; S4    S4 ==&gt; S9
 *   state diagram:  S4 : 4. Wait For Clamp          S3 --&gt; S4
 * </pre>
 * In flowchart mode an edge into a sink state (a state with no outgoing
 * edge) is drawn with the thick {@code ==>} arrow.
 */
public final class DiagramRenderer
{
    static final String NODE_INDENT = "    ";
    static final String ARROW = "-->";
    static final String SINK_ARROW = "==>";

    public DiagramDocument render(TransitionGraph graph,
                                  StateNameTable names,
                                  String title,
                                  DiagramGrammar grammar) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(names, "names");
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(grammar, "grammar");

        return new DiagramDocument(
                grammar,
                title,
                header(title, grammar),
                nodes(graph, names, grammar),
                edges(graph, grammar));
    }

    static String nodeId(int state) {
        return "S" + state;
    }

    private static List<String> header(String title, DiagramGrammar grammar) {
        List<String> lines = new ArrayList<>();
        lines.add("---");
        lines.add("title: " + title.replace("\r", " ").replace("\n", " "));
        lines.add("config:");
        lines.add("  layout: " + grammar.layout());
        lines.add("---");
        lines.addAll(grammar.declaration());
        return lines;
    }

    private static List<String> nodes(TransitionGraph graph, StateNameTable names, DiagramGrammar grammar) {
        List<String> lines = new ArrayList<>(graph.states().size());
        for (int state : graph.states()) {
            String label = LabelSanitizer.sanitize(names.nameOf(state), grammar);
            lines.add(switch (grammar) {
                case FLOWCHART -> NODE_INDENT + nodeId(state) + "[State " + state + ", " + label + "]";
                case STATE_DIAGRAM -> NODE_INDENT + nodeId(state) + " : " + state + ". " + label;
            });
        }
        return lines;
    }

    private static List<String> edges(TransitionGraph graph, DiagramGrammar grammar) {
        List<String> lines = new ArrayList<>(graph.edgeCount());
        for (Map.Entry<Integer, SortedSet<Integer>> entry : graph.edges().entrySet()) {
            int source = entry.getKey();
            for (int target : entry.getValue()) {
                String arrow = grammar == DiagramGrammar.FLOWCHART && graph.isSink(target) ? SINK_ARROW : ARROW;
                lines.add(NODE_INDENT + nodeId(source) + " " + arrow + " " + nodeId(target));
            }
        }
        return lines;
    }
}
