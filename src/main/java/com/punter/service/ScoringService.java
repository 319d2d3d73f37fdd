package com.punter.service;

import com.punter.graph.Distances;
import com.punter.graph.Graph;
import com.punter.graph.Traversal;
import com.punter.model.PunterScore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns a claim coloring into punter scores.
 * <p>
 * For every mine and every site a punter reaches from it over its own rivers, the punter
 * earns the square of the site's distance from the mine in the full graph.
 */
@Service
@Slf4j
public class ScoringService {

    /**
     * Scores one punter.
     *
     * @param graph    the board the distances were computed on
     * @param full     distances from every mine over all rivers
     * @param owned    distances from every mine over the punter's rivers only
     */
    public long score(Graph graph, Map<Integer, Distances> full, Map<Integer, Distances> owned) {
        long total = 0;
        for (int mine : graph.mines()) {
            Distances fromMine = full.get(mine);
            Distances ownedFromMine = owned.get(mine);
            if (fromMine == null || ownedFromMine == null) {
                throw new IllegalArgumentException("Missing distances for mine " + mine);
            }
            for (int site : ownedFromMine.reachableVertices()) {
                int hops = fromMine.distanceTo(site)
                        .orElseThrow(() -> new IllegalStateException(
                                "Site " + site + " reachable over owned rivers but not over all rivers"));
                total += (long) hops * hops;
            }
        }
        return total;
    }

    /**
     * Scores one punter on a finished (or partially claimed) board.
     */
    public long score(Graph graph, int punter) {
        return projectedScore(graph, Traversal.shortestPaths(graph), punter);
    }

    /**
     * Scores the punter as if the rivers claimed so far were final. The full distances do not
     * depend on ownership, so callers searching over many claims compute them once.
     */
    public long projectedScore(Graph graph, Map<Integer, Distances> full, int punter) {
        return score(graph, full, Traversal.shortestPaths(graph.subgraph(punter)));
    }

    /**
     * Scores every punter {@code 0..punters-1}.
     */
    public List<PunterScore> scoreAll(Graph graph, int punters) {
        Map<Integer, Distances> full = Traversal.shortestPaths(graph);
        List<PunterScore> scores = new ArrayList<>(punters);
        for (int punter = 0; punter < punters; punter++) {
            long score = projectedScore(graph, full, punter);
            log.debug("Punter {} scored {}", punter, score);
            scores.add(new PunterScore(punter, score));
        }
        return scores;
    }
}
