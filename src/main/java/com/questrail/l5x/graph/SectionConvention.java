package com.questrail.l5x.graph;

import java.util.Objects;

/**
 * Layout conventions of a state-logic section.
 *
 * <h2>Parameters</h2>
 * <ul>
 *   <li><b>transitionOffset</b> - distance from the start marker to the first
 *       rung that may encode a transition. The marker rung and the cleanup rung
 *       right after it are structural, hence the default of
 *       {@value #DEFAULT_TRANSITION_OFFSET}. No structural marker identifies
 *       the cleanup rung; the offset is a property of how the programs are
 *       written.</li>
 *   <li><b>endMarker</b> - comment text that closes the section. The rung
 *       carrying it is not part of the section.</li>
 * </ul>
 */
public record SectionConvention(int transitionOffset, String endMarker) {

    public static final int DEFAULT_TRANSITION_OFFSET = 2;

    public static final String DEFAULT_END_MARKER = "FAULT";

    public SectionConvention {
        Objects.requireNonNull(endMarker, "endMarker");
        if (transitionOffset < 1) {
            throw new IllegalArgumentException("transitionOffset must be at least 1 (was " + transitionOffset + ")");
        }
        if (endMarker.isBlank()) {
            throw new IllegalArgumentException("endMarker must not be blank");
        }
    }

    public static SectionConvention defaults() {
        return new SectionConvention(DEFAULT_TRANSITION_OFFSET, DEFAULT_END_MARKER);
    }
}
