package com.questrail.l5x.section;

import com.questrail.l5x.api.Routine;
import com.questrail.l5x.api.RungRecord;

import java.util.Objects;
import java.util.Optional;

/**
 * A routine together with the index of its section-start rung and the
 * convention that matched it.
 */
public record LocatedSection(Routine routine, int startIndex, SectionStrategy strategy) {

    public LocatedSection {
        Objects.requireNonNull(routine, "routine");
        Objects.requireNonNull(strategy, "strategy");
        if (startIndex < 0 || startIndex >= routine.size()) {
            throw new IllegalArgumentException("startIndex " + startIndex
                    + " out of range for routine of " + routine.size() + " rungs");
        }
    }

    /**
     * Returns the rung {@code offset} positions after the start marker, if the
     * routine is long enough.
     */
    public Optional<RungRecord> rungAfterStart(int offset) {
        int index = startIndex + offset;
        if (index < 0 || index >= routine.size()) {
            return Optional.empty();
        }
        return Optional.of(routine.rung(index));
    }
}
