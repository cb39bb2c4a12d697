package com.questrail.l5x.render;

import com.questrail.l5x.graph.TransitionGraph;
import com.questrail.l5x.naming.StateNameTable;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

final class DiagramRendererTest
{
    private final DiagramRenderer renderer = new DiagramRenderer();

    private static final TransitionGraph TWO_STEP = TransitionGraph.builder()
            .addEdge(1, 2)
            .addEdge(0, 1)
            .build();

    @Test
    void flowchartDocumentLayout()
    {
        DiagramDocument doc = renderer.render(TWO_STEP, StateNameTable.of(Map.of(0, "Idle")),
                "Seq - Phase", DiagramGrammar.FLOWCHART);

        String expected = String.join("\n",
                "---",
                "title: Seq - Phase",
                "config:",
                "  layout: elk",
                "---",
                "flowchart TB",
                "    S0[State 0, Idle]",
                "    S1[State 1, State 1]",
                "    S2[State 2, State 2]",
                "",
                "    S0 --> S1",
                "    S1 ==> S2");
        assertEquals(expected, doc.text());
    }

    @Test
    void stateDiagramDocumentLayout()
    {
        DiagramDocument doc = renderer.render(TWO_STEP, StateNameTable.of(Map.of(0, "Idle")),
                "Seq - Phase", DiagramGrammar.STATE_DIAGRAM);

        String expected = String.join("\n",
                "---",
                "title: Seq - Phase",
                "config:",
                "  layout: dagre",
                "---",
                "stateDiagram-v2",
                "    direction TB",
                "    S0 : 0. Idle",
                "    S1 : 1. State 1",
                "    S2 : 2. State 2",
                "",
                "    S0 --> S1",
                "    S1 --> S2");
        assertEquals(expected, doc.text());
    }

    @Test
    void edgesAreOrderedBySourceThenTarget()
    {
        TransitionGraph graph = TransitionGraph.builder()
                .addEdge(10, 2)
                .addEdge(2, 10)
                .addEdge(2, 3)
                .addEdge(3, 2)
                .build();

        DiagramDocument doc = renderer.render(graph, StateNameTable.defaults(), "t", DiagramGrammar.FLOWCHART);

        assertEquals(List.of(
                "    S2 --> S3",
                "    S2 --> S10",
                "    S3 --> S2",
                "    S10 --> S2"), doc.edgeLines());
        assertEquals(List.of("    S2[State 2, State 2]", "    S3[State 3, State 3]", "    S10[State 10, State 10]"),
                doc.nodeLines());
    }

    @Test
    void thickArrowOnlyIntoSinksInFlowchart()
    {
        TransitionGraph graph = TransitionGraph.builder()
                .addEdge(2, 0)
                .addEdge(2, 3)
                .addEdge(0, 2)
                .build();

        List<String> flow = renderer.render(graph, StateNameTable.defaults(), "t", DiagramGrammar.FLOWCHART).edgeLines();
        List<String> state = renderer.render(graph, StateNameTable.defaults(), "t", DiagramGrammar.STATE_DIAGRAM).edgeLines();

        assertEquals(List.of("    S0 --> S2", "    S2 --> S0", "    S2 ==> S3"), flow);
        assertTrue(state.stream().noneMatch(line -> line.contains("==>")));
    }

    @Test
    void renderingIsDeterministic()
    {
        StateNameTable names = StateNameTable.of(Map.of(1, "Run"));

        String first = renderer.render(TWO_STEP, names, "t", DiagramGrammar.FLOWCHART).text();
        String second = renderer.render(TWO_STEP, names, "t", DiagramGrammar.FLOWCHART).text();

        assertEquals(first, second);
    }

    @Test
    void emptyGraphRendersHeaderAndSeparatorOnly()
    {
        DiagramDocument doc = renderer.render(TransitionGraph.empty(), StateNameTable.defaults(),
                "t", DiagramGrammar.STATE_DIAGRAM);

        assertTrue(doc.nodeLines().isEmpty());
        assertTrue(doc.edgeLines().isEmpty());
        assertTrue(doc.text().endsWith("    direction TB\n"));
    }

    @Test
    void labelsAreSanitizedPerGrammar()
    {
        StateNameTable names = StateNameTable.of(Map.of(0, "Wait For Clamp\n(Closed)"));
        TransitionGraph graph = TransitionGraph.builder().addEdge(0, 0).build();

        assertEquals(List.of("    S0[State 0, Wait For Clamp - ~Closed~]"),
                renderer.render(graph, names, "t", DiagramGrammar.FLOWCHART).nodeLines());
        assertEquals(List.of("    S0 : 0. Wait For Clamp - (Closed)"),
                renderer.render(graph, names, "t", DiagramGrammar.STATE_DIAGRAM).nodeLines());
    }

    @Test
    void edgesReadBackToTheSameGraph()
    {
        TransitionGraph graph = TransitionGraph.builder()
                .addEdges(0, List.of(1, 4))
                .addEdges(1, List.of(2))
                .addEdges(4, List.of(0, 7))
                .build();
        Pattern edge = Pattern.compile("^\\s+S(\\d+) (?:-->|==>) S(\\d+)$");

        for (DiagramGrammar grammar : DiagramGrammar.values()) {
            TransitionGraph.Builder parsed = TransitionGraph.builder();
            List<String> nodeIds = new ArrayList<>();
            DiagramDocument doc = renderer.render(graph, StateNameTable.defaults(), "t", grammar);
            for (String line : doc.edgeLines()) {
                Matcher m = edge.matcher(line);
                assertTrue(m.matches(), line);
                parsed.addEdge(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
            }
            for (String line : doc.nodeLines()) {
                nodeIds.add(line.strip().split("[\\[ ]", 2)[0]);
            }

            assertEquals(graph, parsed.build(), grammar.name());
            assertEquals(List.of("S0", "S1", "S2", "S4", "S7"), nodeIds, grammar.name());
        }
    }

    @Test
    void titleLineBreaksAreFlattened()
    {
        DiagramDocument doc = renderer.render(TransitionGraph.empty(), StateNameTable.defaults(),
                "A\nB", DiagramGrammar.FLOWCHART);

        assertEquals("title: A B", doc.headerLines().get(1));
    }
}
