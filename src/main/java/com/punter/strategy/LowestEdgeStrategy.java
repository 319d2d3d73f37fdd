package com.punter.strategy;

import com.punter.graph.Edge;
import com.punter.graph.Graph;
import com.punter.model.GameState;

import java.util.List;
import java.util.Map;

/**
 * Always claims the unclaimed river with the lowest id.
 */
public class LowestEdgeStrategy implements Strategy {

    @Override
    public String getName() {
        return StrategyKind.LOWEST_EDGE.getKey();
    }

    @Override
    public Map<String, String> initialize(Graph graph) {
        return Map.of();
    }

    @Override
    public StrategyStep step(GameState state) {
        List<Edge> unclaimed = state.getGraph().unclaimed();
        if (unclaimed.isEmpty()) {
            throw new IllegalStateException("No unclaimed rivers left");
        }
        return new StrategyStep(unclaimed.get(0), state.getStrategyState());
    }
}
