package com.questrail.l5x.graph;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * TransitionGraph
 * -----------------------------------------------------------------------------
 * Immutable directed graph over integer state ids: source state to the set of
 * states it latches.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>All ids are non-negative.</li>
 *   <li>Every source key has a non-empty target set.</li>
 *   <li>Sources and target sets are held in ascending order, so every view and
 *       every iteration is deterministic.</li>
 * </ul>
 *
 * An id may appear only as a target (a sink state) or only as a source; both
 * are legal.
 */
public final class TransitionGraph
{
    private static final TransitionGraph EMPTY = new TransitionGraph(new TreeMap<>());

    private final SortedMap<Integer, SortedSet<Integer>> edges;
    private final SortedSet<Integer> states;

    private TransitionGraph(SortedMap<Integer, SortedSet<Integer>> edges) {
        SortedMap<Integer, SortedSet<Integer>> copy = new TreeMap<>();
        SortedSet<Integer> all = new TreeSet<>();
        for (Map.Entry<Integer, SortedSet<Integer>> e : edges.entrySet()) {
            copy.put(e.getKey(), Collections.unmodifiableSortedSet(new TreeSet<>(e.getValue())));
            all.add(e.getKey());
            all.addAll(e.getValue());
        }
        this.edges = Collections.unmodifiableSortedMap(copy);
        this.states = Collections.unmodifiableSortedSet(all);
    }

    public static TransitionGraph empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the source-to-targets mapping, ordered by source id.
     */
    public SortedMap<Integer, SortedSet<Integer>> edges() {
        return edges;
    }

    /**
     * Returns the ids that have at least one outgoing edge, ascending.
     */
    public SortedSet<Integer> sources() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(edges.keySet()));
    }

    /**
     * Returns the targets of {@code source}, ascending; empty for sinks and
     * unknown ids.
     */
    public SortedSet<Integer> targets(int source) {
        SortedSet<Integer> targets = edges.get(source);
        return targets != null ? targets : Collections.emptySortedSet();
    }

    /**
     * Returns every id that appears as a source or a target, ascending.
     */
    public SortedSet<Integer> states() {
        return states;
    }

    /**
     * Returns the number of distinct edges.
     */
    public int edgeCount() {
        int count = 0;
        for (SortedSet<Integer> targets : edges.values()) {
            count += targets.size();
        }
        return count;
    }

    public int outDegree(int state) {
        return targets(state).size();
    }

    /**
     * Returns true if {@code state} has no recorded outgoing edge.
     */
    public boolean isSink(int state) {
        return !edges.containsKey(state);
    }

    public boolean isEmpty() {
        return edges.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TransitionGraph that)) return false;
        return edges.equals(that.edges);
    }

    @Override
    public int hashCode() {
        return edges.hashCode();
    }

    @Override
    public String toString() {
        return "TransitionGraph" + edges;
    }

    /**
     * Accumulates edges; set semantics fold duplicate edges together.
     */
    public static final class Builder {
        private final SortedMap<Integer, SortedSet<Integer>> edges = new TreeMap<>();

        private Builder() {}

        /**
         * Adds edges from {@code source} to each of {@code targets}. An empty
         * target collection adds nothing and does not register the source.
         */
        public Builder addEdges(int source, Collection<Integer> targets) {
            Objects.requireNonNull(targets, "targets");
            requireStateId(source);
            if (targets.isEmpty()) {
                return this;
            }
            SortedSet<Integer> set = edges.computeIfAbsent(source, k -> new TreeSet<>());
            for (Integer target : targets) {
                set.add(requireStateId(Objects.requireNonNull(target, "target")));
            }
            return this;
        }

        public Builder addEdge(int source, int target) {
            requireStateId(source);
            edges.computeIfAbsent(source, k -> new TreeSet<>()).add(requireStateId(target));
            return this;
        }

        public TransitionGraph build() {
            return edges.isEmpty() ? EMPTY : new TransitionGraph(edges);
        }

        private static int requireStateId(int id) {
            if (id < 0) {
                throw new IllegalArgumentException("State ids must be non-negative (was " + id + ")");
            }
            return id;
        }
    }
}
