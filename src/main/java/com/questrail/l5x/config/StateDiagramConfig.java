package com.questrail.l5x.config;

import com.questrail.l5x.graph.SectionConvention;
import com.questrail.l5x.project.L5xProjectLoader;
import com.questrail.l5x.render.DiagramGrammar;
import com.questrail.l5x.section.SectionStrategy;

import java.util.List;
import java.util.Objects;

/**
 * Aggregated configuration for one diagram generation run.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>sectionStrategies</b> - section-start conventions, tried in order.
 *       Default: instruction marker, then comment marker.</li>
 *   <li><b>convention</b> - transition offset and end marker of the section.</li>
 *   <li><b>grammar</b> - output diagram grammar. Default: flowchart.</li>
 *   <li><b>stateTagDataType</b> - data type that identifies the state tag
 *       during data-type detection. Default: {@value #DEFAULT_STATE_TAG_DATA_TYPE}.</li>
 *   <li><b>stateBitMember</b> - bit-array member holding the state flags.
 *       Default: {@value #DEFAULT_STATE_BIT_MEMBER}.</li>
 *   <li><b>acceptDefaultNames</b> - when no state tag can be resolved, render
 *       with {@code "State n"} names instead of failing. Default: false.</li>
 *   <li><b>commentLanguage</b> - preferred language of localized comments.</li>
 * </ul>
 */
public record StateDiagramConfig(
        List<SectionStrategy> sectionStrategies,
        SectionConvention convention,
        DiagramGrammar grammar,
        String stateTagDataType,
        String stateBitMember,
        boolean acceptDefaultNames,
        String commentLanguage
) {
    public static final String DEFAULT_STATE_TAG_DATA_TYPE = "StateLogic";

    public static final String DEFAULT_STATE_BIT_MEMBER = "ST";

    public static final List<SectionStrategy> DEFAULT_SECTION_STRATEGIES =
            List.of(SectionStrategy.INSTRUCTION_MARKER, SectionStrategy.COMMENT_MARKER);

    public StateDiagramConfig {
        Objects.requireNonNull(sectionStrategies, "sectionStrategies");
        Objects.requireNonNull(convention, "convention");
        Objects.requireNonNull(grammar, "grammar");
        Objects.requireNonNull(stateTagDataType, "stateTagDataType");
        Objects.requireNonNull(stateBitMember, "stateBitMember");
        Objects.requireNonNull(commentLanguage, "commentLanguage");

        if (sectionStrategies.isEmpty()) {
            throw new IllegalArgumentException("At least one section strategy required");
        }
        if (sectionStrategies.stream().distinct().count() != sectionStrategies.size()) {
            throw new IllegalArgumentException("Duplicate section strategy in " + sectionStrategies);
        }
        if (stateBitMember.isBlank()) {
            throw new IllegalArgumentException("stateBitMember must not be blank");
        }
        sectionStrategies = List.copyOf(sectionStrategies);
    }

    public static StateDiagramConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private List<SectionStrategy> sectionStrategies = DEFAULT_SECTION_STRATEGIES;
        private int transitionOffset = SectionConvention.DEFAULT_TRANSITION_OFFSET;
        private String endMarker = SectionConvention.DEFAULT_END_MARKER;
        private DiagramGrammar grammar = DiagramGrammar.FLOWCHART;
        private String stateTagDataType = DEFAULT_STATE_TAG_DATA_TYPE;
        private String stateBitMember = DEFAULT_STATE_BIT_MEMBER;
        private boolean acceptDefaultNames = false;
        private String commentLanguage = L5xProjectLoader.DEFAULT_LANGUAGE;

        public Builder withSectionStrategies(List<SectionStrategy> strategies) {
            this.sectionStrategies = strategies;
            return this;
        }

        public Builder withSectionStrategies(SectionStrategy... strategies) {
            this.sectionStrategies = List.of(strategies);
            return this;
        }

        public Builder withTransitionOffset(int transitionOffset) {
            this.transitionOffset = transitionOffset;
            return this;
        }

        public Builder withEndMarker(String endMarker) {
            this.endMarker = endMarker;
            return this;
        }

        public Builder withGrammar(DiagramGrammar grammar) {
            this.grammar = grammar;
            return this;
        }

        public Builder withStateTagDataType(String dataType) {
            this.stateTagDataType = dataType;
            return this;
        }

        public Builder withStateBitMember(String member) {
            this.stateBitMember = member;
            return this;
        }

        public Builder withAcceptDefaultNames(boolean accept) {
            this.acceptDefaultNames = accept;
            return this;
        }

        public Builder withCommentLanguage(String language) {
            this.commentLanguage = language;
            return this;
        }

        public StateDiagramConfig build() {
            return new StateDiagramConfig(
                    sectionStrategies,
                    new SectionConvention(transitionOffset, endMarker),
                    grammar,
                    stateTagDataType,
                    stateBitMember,
                    acceptDefaultNames,
                    commentLanguage);
        }
    }
}
