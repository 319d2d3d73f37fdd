package com.punter.graph;

import com.punter.exception.ConstructionException;

/**
 * A river between two sites, referenced by internal vertex index.
 * The lower index always comes first.
 *
 * @param id identity of the river, stable for the whole game
 * @param u  lower internal vertex index
 * @param v  higher internal vertex index
 */
public record Edge(int id, int u, int v) {

    public Edge {
        if (u > v) {
            throw new ConstructionException("Edge " + id + " ends out of order: (" + u + ", " + v + ")");
        }
        if (u < 0) {
            throw new ConstructionException("Edge " + id + " has a negative end: " + u);
        }
    }

    /**
     * Builds an edge from ends in any order.
     */
    public static Edge between(int id, int a, int b) {
        return new Edge(id, Math.min(a, b), Math.max(a, b));
    }

    public Ends ends() {
        return new Ends(u, v);
    }

    public boolean contains(int w) {
        return u == w || v == w;
    }

    public boolean connects(int a, int b) {
        return (u == a && v == b) || (u == b && v == a);
    }

    /**
     * The end of this edge that is not {@code w}.
     *
     * @throws IllegalArgumentException if {@code w} is not an end of this edge
     */
    public int opposite(int w) {
        if (w == u) {
            return v;
        }
        if (w == v) {
            return u;
        }
        throw new IllegalArgumentException("Vertex " + w + " is not an end of edge " + id);
    }

    /**
     * A pair of vertex identities; internal indices or map ids depending on where it came from.
     */
    public record Ends(int source, int target) {}
}
