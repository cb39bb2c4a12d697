package com.questrail.l5x.section;

import com.questrail.l5x.api.ControllerProject;
import com.questrail.l5x.api.Routine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * SectionFinder
 * -----------------------------------------------------------------------------
 * Searches a whole project for the routine that holds the state machine.
 *
 * <p>Strategies are tried in the configured order. For each strategy every
 * ladder routine is scanned in document order and the first match wins, so a
 * match under an earlier strategy always beats one under a later strategy,
 * regardless of where the routines sit in the document.</p>
 */
public final class SectionFinder
{
    private static final Logger log = LoggerFactory.getLogger(SectionFinder.class);

    private final List<SectionStrategy> strategies;

    public SectionFinder(List<SectionStrategy> strategies) {
        Objects.requireNonNull(strategies, "strategies");
        if (strategies.isEmpty()) {
            throw new IllegalArgumentException("At least one section strategy is required");
        }
        this.strategies = List.copyOf(strategies);
    }

    /**
     * Returns the first located section, or empty if no routine matches.
     */
    public Optional<LocatedSection> find(ControllerProject project) {
        Objects.requireNonNull(project, "project");
        for (SectionStrategy strategy : strategies) {
            SectionLocator locator = strategy.locator();
            for (Routine routine : project.routines()) {
                OptionalInt start = locator.locateStart(routine.rungs());
                if (start.isPresent()) {
                    log.debug("{} matched {}/{} at rung {}",
                            strategy, routine.programName(), routine.routineName(), start.getAsInt());
                    return Optional.of(new LocatedSection(routine, start.getAsInt(), strategy));
                }
            }
            log.debug("{} matched no routine", strategy);
        }
        return Optional.empty();
    }

    /**
     * Like {@link #find(ControllerProject)} but treats "not found" as fatal.
     *
     * @throws StateLogicNotFoundException if no routine matches
     */
    public LocatedSection locate(ControllerProject project) {
        return find(project).orElseThrow(() -> new StateLogicNotFoundException(
                "No STATE LOGIC section found in file (tried " + strategies + ")"));
    }
}
