package com.questrail.l5x.naming;

import com.questrail.l5x.api.ControllerProject;
import com.questrail.l5x.api.ControllerTag;
import com.questrail.l5x.logic.InstructionParser;
import com.questrail.l5x.logic.StateRefs;
import com.questrail.l5x.section.LocatedSection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * StateTagSelector
 * -----------------------------------------------------------------------------
 * Decides which controller tag holds the state bits.
 *
 * <p>An explicit tag name always wins and is used verbatim, without checking
 * that it exists; a wrong name simply degrades every state to its default
 * name. Otherwise the {@link TagDetection} paired with the section's
 * convention is tried first and the remaining detections after it; the first
 * candidate found wins.</p>
 */
public final class StateTagSelector
{
    private static final Logger log = LoggerFactory.getLogger(StateTagSelector.class);

    private final String stateTagDataType;
    private final String stateBitMember;
    private final InstructionParser parser = new InstructionParser();

    /**
     * @param stateTagDataType data type that marks a state-holder tag, for
     *                         {@link TagDetection#DATA_TYPE}
     * @param stateBitMember   member a state-holder tag must expose, for
     *                         {@link TagDetection#LEADING_XIC}
     */
    public StateTagSelector(String stateTagDataType, String stateBitMember) {
        this.stateTagDataType = Objects.requireNonNull(stateTagDataType, "stateTagDataType");
        this.stateBitMember = Objects.requireNonNull(stateBitMember, "stateBitMember");
    }

    /**
     * Selects the state tag.
     *
     * @param explicitTag caller-supplied tag name, if any
     * @param project     the loaded project
     * @param section     the located state-logic section
     * @return the selected tag name
     * @throws StateTagResolutionException if no tag was supplied and detection fails
     */
    public String select(Optional<String> explicitTag, ControllerProject project, LocatedSection section) {
        Objects.requireNonNull(explicitTag, "explicitTag");
        if (explicitTag.isPresent()) {
            return explicitTag.get();
        }
        List<TagDetection> order = TagDetection.tryOrder(section.strategy());
        for (TagDetection detection : order) {
            Optional<String> tag = detect(detection, project, section);
            if (tag.isPresent()) {
                log.debug("State tag {} found by {}", tag.get(), detection);
                return tag.get();
            }
        }
        throw new StateTagResolutionException(
                "Could not auto-detect state tag (tried " + order + "). Please specify the tag name.");
    }

    /**
     * Applies one detection strategy.
     *
     * @return the detected tag name, or empty if the strategy finds no candidate
     */
    public Optional<String> detect(TagDetection detection, ControllerProject project, LocatedSection section) {
        Objects.requireNonNull(detection, "detection");
        Objects.requireNonNull(project, "project");
        Objects.requireNonNull(section, "section");
        return switch (detection) {
            case DATA_TYPE -> detectByDataType(project);
            case LEADING_XIC -> detectByLeadingExamine(project, section);
        };
    }

    private Optional<String> detectByDataType(ControllerProject project) {
        for (ControllerTag tag : project.tags()) {
            if (stateTagDataType.equals(tag.dataType())) {
                log.debug("Tag {} has data type {}", tag.name(), stateTagDataType);
                return Optional.of(tag.name());
            }
        }
        return Optional.empty();
    }

    private Optional<String> detectByLeadingExamine(ControllerProject project, LocatedSection section) {
        Optional<String> operand = section.rungAfterStart(1)
                .flatMap(rung -> rung.logicText())
                .flatMap(parser::leadingExamineOperand);
        if (operand.isEmpty()) {
            log.debug("Rung after section start has no leading XIC");
            return Optional.empty();
        }

        String candidate = StateRefs.tagRoot(operand.get());
        Optional<ControllerTag> tag = project.tag(candidate);
        if (tag.isEmpty()) {
            log.debug("Candidate tag {} is not in the tag table", candidate);
            return Optional.empty();
        }
        if (!tag.get().hasMember(stateBitMember)) {
            log.debug("Candidate tag {} has no {} member", candidate, stateBitMember);
            return Optional.empty();
        }
        return Optional.of(candidate);
    }
}
