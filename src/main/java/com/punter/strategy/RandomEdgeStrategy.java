package com.punter.strategy;

import com.punter.graph.Edge;
import com.punter.graph.Graph;
import com.punter.model.GameState;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Random strategy - claims a pseudo-random unclaimed river.
 * The generator seed is carried in the strategy state, so a game replays identically.
 */
public class RandomEdgeStrategy implements Strategy {

    static final String SEED_KEY = "seed";

    private final long initialSeed;

    public RandomEdgeStrategy(long initialSeed) {
        this.initialSeed = initialSeed;
    }

    @Override
    public String getName() {
        return StrategyKind.RANDOM_EDGE.getKey();
    }

    @Override
    public Map<String, String> initialize(Graph graph) {
        return Map.of(SEED_KEY, Long.toString(initialSeed));
    }

    @Override
    public StrategyStep step(GameState state) {
        List<Edge> unclaimed = state.getGraph().unclaimed();
        if (unclaimed.isEmpty()) {
            throw new IllegalStateException("No unclaimed rivers left");
        }

        String stored = state.getStrategyState().get(SEED_KEY);
        Random random = new Random(stored == null ? initialSeed : Long.parseLong(stored));
        Edge choice = unclaimed.get(random.nextInt(unclaimed.size()));

        Map<String, String> next = new HashMap<>(state.getStrategyState());
        next.put(SEED_KEY, Long.toString(random.nextLong()));
        return new StrategyStep(choice, next);
    }
}
