package com.questrail.l5x.graph;

import com.questrail.l5x.api.RungRecord;
import com.questrail.l5x.logic.InstructionParser;
import com.questrail.l5x.logic.RungTransition;
import com.questrail.l5x.section.LocatedSection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * TransitionGraphBuilder
 * -----------------------------------------------------------------------------
 * Folds the transition rungs of a state-logic section into a
 * {@link TransitionGraph}.
 *
 * <h2>Scan window</h2>
 * Scanning begins at {@code start + transitionOffset} and stops, exclusively,
 * at the first rung whose comment contains the end marker, or at the end of
 * the routine.
 *
 * <h2>Per-rung handling</h2>
 * Each rung goes through the {@link InstructionParser}. Rungs with a source and
 * at least one target add their edges; all other rungs are skipped without
 * effect. An empty result is legal and left to the caller to report.
 */
public final class TransitionGraphBuilder
{
    private static final Logger log = LoggerFactory.getLogger(TransitionGraphBuilder.class);

    private final SectionConvention convention;
    private final InstructionParser parser;

    public TransitionGraphBuilder(SectionConvention convention) {
        this(convention, new InstructionParser());
    }

    public TransitionGraphBuilder(SectionConvention convention, InstructionParser parser) {
        this.convention = Objects.requireNonNull(convention, "convention");
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    public TransitionGraph build(LocatedSection section) {
        Objects.requireNonNull(section, "section");
        return build(section.routine().rungs(), section.startIndex());
    }

    /**
     * Builds the graph of the section starting at {@code startIndex}.
     *
     * @param rungs      the routine's rungs
     * @param startIndex index of the section-start marker rung
     * @return the transition graph, possibly empty
     */
    public TransitionGraph build(List<RungRecord> rungs, int startIndex) {
        Objects.requireNonNull(rungs, "rungs");
        if (startIndex < 0) {
            throw new IllegalArgumentException("startIndex must be non-negative (was " + startIndex + ")");
        }

        TransitionGraph.Builder graph = TransitionGraph.builder();
        // Clamped to the routine end; the sum may exceed Integer.MAX_VALUE.
        int first = (int) Math.min((long) startIndex + convention.transitionOffset(), rungs.size());
        int scanned = 0;
        for (int i = first; i < rungs.size(); i++) {
            RungRecord rung = rungs.get(i);
            if (rung.commentContains(convention.endMarker())) {
                log.debug("End marker '{}' at rung {}", convention.endMarker(), i);
                break;
            }
            scanned++;
            RungTransition transition = parser.parse(rung);
            if (transition.isTransition()) {
                graph.addEdges(transition.source().getAsInt(), transition.targets());
            }
        }
        TransitionGraph result = graph.build();
        log.debug("Scanned {} rungs from index {}: {} sources, {} edges",
                scanned, first, result.sources().size(), result.edgeCount());
        return result;
    }
}
