package com.questrail.l5x.section;

import com.questrail.l5x.api.RungRecord;

import java.util.List;
import java.util.OptionalInt;

/**
 * Strategy for finding the rung that opens the state-logic section of a
 * routine.
 *
 * <p>"Not found" is an ordinary answer. Routines are scanned one after another
 * until one of them contains a section, so most routines report empty.</p>
 */
@FunctionalInterface
public interface SectionLocator
{
    /**
     * Returns the index of the section-start rung within {@code rungs}.
     *
     * @param rungs one routine's rungs, in order
     * @return index of the first matching rung, or empty if none matches
     */
    OptionalInt locateStart(List<RungRecord> rungs);
}
