package com.punter.strategy;

import com.punter.graph.Distances;
import com.punter.graph.Edge;
import com.punter.graph.Graph;
import com.punter.graph.Traversal;
import com.punter.model.GameState;
import com.punter.service.ScoringService;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

/**
 * Minimax strategy with alpha-beta pruning.
 * <p>
 * Our punter maximizes its projected score. Every other punter is modeled on its own turn,
 * in turn order, as an adversary minimizing that same score.
 */
@Slf4j
public class MinimaxStrategy implements Strategy {

    private final int depth;
    private final ScoringService scoringService;

    public MinimaxStrategy(int depth, ScoringService scoringService) {
        if (depth < 1) {
            throw new IllegalArgumentException("Search depth must be at least 1, was " + depth);
        }
        this.depth = depth;
        this.scoringService = scoringService;
    }

    @Override
    public String getName() {
        return StrategyKind.MINIMAX.getKey();
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
            throw new IllegalStateException(getName() + " was asked to move without an acting punter");
        }

        int me = state.getMe();
        GameState turns = state.withPunters(Math.max(state.getPunters(), me + 1));
        Map<Integer, Distances> full = Traversal.shortestPaths(graph);

        Edge best = null;
        long bestScore = Long.MIN_VALUE;
        for (Edge edge : candidates) {
            long value = minimax(graph.claim(me, edge.id()), turns.nextPunter(me), me, depth - 1,
                    bestScore, Long.MAX_VALUE, full, turns);
            if (best == null || value > bestScore) {
                bestScore = value;
                best = edge;
            }
        }

        log.debug("minimax (punter {}) picks river {} with value {}", me, best.id(), bestScore);
        return new StrategyStep(best, state.getStrategyState());
    }

    private long minimax(Graph graph, int acting, int root, int remaining, long alpha, long beta,
                         Map<Integer, Distances> full, GameState turns) {
        if (remaining == 0 || !graph.hasUnclaimed()) {
            return scoringService.projectedScore(graph, full, root);
        }

        boolean maximizing = acting == root;
        long value = maximizing ? Long.MIN_VALUE : Long.MAX_VALUE;
        for (Edge edge : graph.unclaimed()) {
            long child = minimax(graph.claim(acting, edge.id()), turns.nextPunter(acting), root,
                    remaining - 1, alpha, beta, full, turns);
            if (maximizing) {
                value = Math.max(value, child);
                alpha = Math.max(alpha, value);
            } else {
                value = Math.min(value, child);
                beta = Math.min(beta, value);
            }
            if (alpha >= beta) {
                break;
            }
        }
        return value;
    }
}
