package com.questrail.l5x.config;

import com.questrail.l5x.graph.SectionConvention;
import com.questrail.l5x.render.DiagramGrammar;
import com.questrail.l5x.section.SectionStrategy;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class StateDiagramConfigTest
{
    @Test
    void defaults()
    {
        StateDiagramConfig config = StateDiagramConfig.defaults();

        assertEquals(List.of(SectionStrategy.INSTRUCTION_MARKER, SectionStrategy.COMMENT_MARKER),
                config.sectionStrategies());
        assertEquals(SectionConvention.defaults(), config.convention());
        assertEquals(2, config.convention().transitionOffset());
        assertEquals("FAULT", config.convention().endMarker());
        assertEquals(DiagramGrammar.FLOWCHART, config.grammar());
        assertEquals("StateLogic", config.stateTagDataType());
        assertEquals("ST", config.stateBitMember());
        assertFalse(config.acceptDefaultNames());
        assertEquals("en-US", config.commentLanguage());
    }

    @Test
    void builderOverridesEveryField()
    {
        StateDiagramConfig config = StateDiagramConfig.builder()
                .withSectionStrategies(SectionStrategy.COMMENT_MARKER)
                .withTransitionOffset(3)
                .withEndMarker("END")
                .withGrammar(DiagramGrammar.STATE_DIAGRAM)
                .withStateTagDataType("UDT_Seq")
                .withStateBitMember("Step")
                .withAcceptDefaultNames(true)
                .withCommentLanguage("fr-FR")
                .build();

        assertEquals(List.of(SectionStrategy.COMMENT_MARKER), config.sectionStrategies());
        assertEquals(new SectionConvention(3, "END"), config.convention());
        assertEquals(DiagramGrammar.STATE_DIAGRAM, config.grammar());
        assertEquals("UDT_Seq", config.stateTagDataType());
        assertEquals("Step", config.stateBitMember());
        assertTrue(config.acceptDefaultNames());
        assertEquals("fr-FR", config.commentLanguage());
    }

    @Test
    void strategyListIsCopied()
    {
        List<SectionStrategy> strategies = new ArrayList<>(List.of(SectionStrategy.COMMENT_MARKER));
        StateDiagramConfig config = StateDiagramConfig.builder().withSectionStrategies(strategies).build();

        strategies.add(SectionStrategy.INSTRUCTION_MARKER);

        assertEquals(List.of(SectionStrategy.COMMENT_MARKER), config.sectionStrategies());
    }

    @Test
    void rejectsInvalidValues()
    {
        assertThrows(IllegalArgumentException.class,
                () -> StateDiagramConfig.builder().withSectionStrategies(List.of()).build());
        assertThrows(IllegalArgumentException.class,
                () -> StateDiagramConfig.builder()
                        .withSectionStrategies(SectionStrategy.COMMENT_MARKER, SectionStrategy.COMMENT_MARKER)
                        .build());
        assertThrows(IllegalArgumentException.class,
                () -> StateDiagramConfig.builder().withTransitionOffset(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> StateDiagramConfig.builder().withEndMarker(" ").build());
        assertThrows(IllegalArgumentException.class,
                () -> StateDiagramConfig.builder().withStateBitMember("").build());
        assertThrows(NullPointerException.class,
                () -> StateDiagramConfig.builder().withGrammar(null).build());
    }
}
