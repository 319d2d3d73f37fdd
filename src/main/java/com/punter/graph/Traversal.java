package com.punter.graph;

import com.punter.exception.NotFoundException;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Breadth-first shortest paths over whatever rivers a graph snapshot contains.
 * Run it on a full graph to ignore ownership, or on a {@link Graph#subgraph} to
 * follow only one punter's rivers.
 */
public final class Traversal {

    private Traversal() {}

    /**
     * Computes the shortest hop count from {@code source} to every vertex.
     *
     * @throws NotFoundException if {@code source} is not a vertex index of the graph
     */
    public static Distances shortestPath(Graph graph, int source) {
        if (source < 0 || source >= graph.vertexCount()) {
            throw new NotFoundException("No vertex with index " + source);
        }
        int[] hops = Distances.unreachableTable(graph.vertexCount());
        Deque<Integer> queue = new ArrayDeque<>();
        hops[source] = 0;
        queue.add(source);

        while (!queue.isEmpty()) {
            int current = queue.poll();
            for (int next : graph.adjacent(current)) {
                if (Distances.isUnreached(hops, next)) {
                    hops[next] = hops[current] + 1;
                    queue.add(next);
                }
            }
        }
        return new Distances(source, hops);
    }

    /**
     * Runs {@link #shortestPath} from every mine, keyed by mine index in ascending order.
     */
    public static Map<Integer, Distances> shortestPaths(Graph graph) {
        Map<Integer, Distances> byMine = new LinkedHashMap<>();
        for (int mine : graph.mines()) {
            byMine.put(mine, shortestPath(graph, mine));
        }
        return Collections.unmodifiableMap(byMine);
    }
}
