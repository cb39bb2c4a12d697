package com.questrail.l5x.api;

import java.util.List;
import java.util.Objects;

/**
 * A ladder-logic routine: its owning program, its own name, and its rungs in
 * document order.
 *
 * <p>The rung list is copied defensively and is unmodifiable.</p>
 */
public record Routine(
        String programName,
        String routineName,
        List<RungRecord> rungs
) {
    public Routine {
        Objects.requireNonNull(programName, "programName");
        Objects.requireNonNull(routineName, "routineName");
        rungs = List.copyOf(Objects.requireNonNull(rungs, "rungs"));
    }

    /**
     * Returns the rung at {@code index}.
     *
     * @throws IndexOutOfBoundsException if index is out of range
     */
    public RungRecord rung(int index) {
        return rungs.get(index);
    }

    /**
     * Returns the number of rungs in this routine.
     */
    public int size() {
        return rungs.size();
    }
}
