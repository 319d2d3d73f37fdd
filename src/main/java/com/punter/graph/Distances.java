package com.punter.graph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.OptionalInt;

/**
 * Shortest river-hop distances from one source vertex to every vertex of a graph.
 */
public final class Distances {

    private static final int UNREACHABLE = -1;

    private final int source;
    private final int[] hops;

    Distances(int source, int[] hops) {
        this.source = source;
        this.hops = hops;
    }

    static int[] unreachableTable(int size) {
        int[] table = new int[size];
        Arrays.fill(table, UNREACHABLE);
        return table;
    }

    static boolean isUnreached(int[] table, int vertex) {
        return table[vertex] == UNREACHABLE;
    }

    public int source() {
        return source;
    }

    /** Number of vertices covered, reachable or not. */
    public int size() {
        return hops.length;
    }

    public boolean isReachable(int vertex) {
        return hops[vertex] != UNREACHABLE;
    }

    /**
     * @return the hop count, or empty when {@code vertex} cannot be reached from the source
     */
    public OptionalInt distanceTo(int vertex) {
        return isReachable(vertex) ? OptionalInt.of(hops[vertex]) : OptionalInt.empty();
    }

    public List<Integer> reachableVertices() {
        List<Integer> reachable = new ArrayList<>();
        for (int v = 0; v < hops.length; v++) {
            if (hops[v] != UNREACHABLE) {
                reachable.add(v);
            }
        }
        return reachable;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Distances other)) return false;
        return source == other.source && Arrays.equals(hops, other.hops);
    }

    @Override
    public int hashCode() {
        return 31 * source + Arrays.hashCode(hops);
    }

    @Override
    public String toString() {
        return "Distances{source=" + source + ", hops=" + Arrays.toString(hops) + "}";
    }
}
