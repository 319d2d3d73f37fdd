package com.punter.strategy;

import com.punter.graph.Distances;
import com.punter.graph.Edge;
import com.punter.graph.Graph;
import com.punter.graph.Traversal;
import com.punter.model.GameState;
import com.punter.service.ScoringService;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Brute-force lookahead strategy - tries every sequence of claims up to a fixed depth.
 * <p>
 * Each modeled punter, in turn order, picks the river that maximizes its own projected
 * score at the cutoff. With depth 1 only our own claim is tried and opponents are ignored.
 */
@Slf4j
public class BruteForceStrategy implements Strategy {

    static final String PROJECTED_SCORE_KEY = "projected-score";

    private final String name;
    private final int depth;
    private final ScoringService scoringService;

    public BruteForceStrategy(String name, int depth, ScoringService scoringService) {
        if (depth < 1) {
            throw new IllegalArgumentException("Lookahead depth must be at least 1, was " + depth);
        }
        this.name = name;
        this.depth = depth;
        this.scoringService = scoringService;
    }

    @Override
    public String getName() {
        return name;
    }

    public int getDepth() {
        return depth;
    }

    @Override
    public Map<String, String> initialize(Graph graph) {
        return Map.of();
    }

    @Override
    public StrategyStep step(GameState state) {
        Graph graph = state.getGraph();
        List<Edge> candidates = graph.unclaimed();
        if (candidates.isEmpty()) {
            throw new IllegalStateException("No unclaimed rivers left");
        }
        if (!state.hasPerspective()) {
            throw new IllegalStateException(name + " was asked to move without an acting punter");
        }

        int me = state.getMe();
        GameState turns = state.withPunters(Math.max(state.getPunters(), me + 1));
        Map<Integer, Distances> full = Traversal.shortestPaths(graph);

        Edge best = null;
        long bestScore = Long.MIN_VALUE;
        for (Edge edge : candidates) {
            Graph claimed = graph.claim(me, edge.id());
            long projected = depth == 1
                    ? scoringService.projectedScore(claimed, full, me)
                    : search(claimed, turns.nextPunter(me), depth - 1, full, turns)[me];
            if (projected > bestScore) {
                bestScore = projected;
                best = edge;
            }
        }

        log.debug("{} (punter {}) picks river {} projecting {}", name, me, best.id(), bestScore);

        Map<String, String> next = new HashMap<>(state.getStrategyState());
        next.put(PROJECTED_SCORE_KEY, Long.toString(bestScore));
        return new StrategyStep(best, next);
    }

    /**
     * Projected scores of every punter after {@code acting} and the punters after it play
     * {@code remaining} more claims.
     */
    private long[] search(Graph graph, int acting, int remaining, Map<Integer, Distances> full, GameState turns) {
        if (remaining == 0 || !graph.hasUnclaimed()) {
            return evaluate(graph, full, turns.getPunters());
        }

        long[] best = null;
        for (Edge edge : graph.unclaimed()) {
            long[] outcome = search(graph.claim(acting, edge.id()), turns.nextPunter(acting),
                    remaining - 1, full, turns);
            if (best == null || outcome[acting] > best[acting]) {
                best = outcome;
            }
        }
        return best;
    }

    private long[] evaluate(Graph graph, Map<Integer, Distances> full, int punters) {
        long[] scores = new long[punters];
        for (int punter = 0; punter < punters; punter++) {
            scores[punter] = scoringService.projectedScore(graph, full, punter);
        }
        return scores;
    }
}
