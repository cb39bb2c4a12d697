package com.questrail.l5x.logic;

import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Edge contribution of a single rung: at most one source state and the
 * latched target states in scan order. Duplicate targets are kept here; the
 * graph builder folds them into a set.
 */
public record RungTransition(OptionalInt source, List<Integer> targets) {

    /** Contribution of a rung that encodes no transition. */
    public static final RungTransition NONE = new RungTransition(OptionalInt.empty(), List.of());

    public RungTransition {
        Objects.requireNonNull(source, "source");
        targets = List.copyOf(Objects.requireNonNull(targets, "targets"));
    }

    /**
     * Returns true if this rung has a source and at least one target.
     */
    public boolean isTransition() {
        return source.isPresent() && !targets.isEmpty();
    }
}
