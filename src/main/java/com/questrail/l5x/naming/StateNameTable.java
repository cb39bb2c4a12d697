package com.questrail.l5x.naming;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Display names of states, keyed by state id. States without an entry read
 * as their synthesized default name.
 */
public final class StateNameTable
{
    private static final StateNameTable EMPTY = new StateNameTable(Map.of());

    private final SortedMap<Integer, String> names;

    private StateNameTable(Map<Integer, String> names) {
        this.names = Collections.unmodifiableSortedMap(new TreeMap<>(names));
    }

    public static StateNameTable of(Map<Integer, String> names) {
        Objects.requireNonNull(names, "names");
        return names.isEmpty() ? EMPTY : new StateNameTable(names);
    }

    /**
     * Returns a table with no entries, so every state reads as its default.
     */
    public static StateNameTable defaults() {
        return EMPTY;
    }

    /**
     * Returns the synthesized name used when no description is available.
     */
    public static String defaultName(int state) {
        return "State " + state;
    }

    public String nameOf(int state) {
        String name = names.get(state);
        return name != null ? name : defaultName(state);
    }

    public SortedMap<Integer, String> asMap() {
        return names;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StateNameTable that)) return false;
        return names.equals(that.names);
    }

    @Override
    public int hashCode() {
        return names.hashCode();
    }

    @Override
    public String toString() {
        return "StateNameTable" + names;
    }
}
