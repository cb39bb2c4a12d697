package com.questrail.l5x.render;

import java.util.List;

/**
 * The two Mermaid grammars a transition graph can be rendered in.
 */
public enum DiagramGrammar
{
    /** {@code flowchart TB}, laid out by ELK. */
    FLOWCHART("elk", List.of("flowchart TB")),

    /** {@code stateDiagram-v2}, laid out by dagre. */
    STATE_DIAGRAM("dagre", List.of("stateDiagram-v2", "    direction TB"));

    private final String layout;
    private final List<String> declaration;

    DiagramGrammar(String layout, List<String> declaration) {
        this.layout = layout;
        this.declaration = declaration;
    }

    /**
     * Returns the layout engine hint written into the front matter.
     */
    public String layout() {
        return layout;
    }

    /**
     * Returns the lines that open the diagram body.
     */
    public List<String> declaration() {
        return declaration;
    }
}
