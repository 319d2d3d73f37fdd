package com.punter.strategy;

import com.punter.graph.Graph;
import com.punter.model.GameState;

import java.util.Map;

/**
 * Strategy interface for punters.
 * Implementations keep no mutable fields: anything that must survive between turns goes
 * into the state map, which the caller hands back on the next {@link #step}.
 */
public interface Strategy {

    /**
     * Name used in logs and score reports.
     */
    String getName();

    /**
     * Build the initial strategy state for a new game on {@code graph}.
     */
    Map<String, String> initialize(Graph graph);

    /**
     * Choose one river from {@code state.getGraph().unclaimed()} for punter {@code state.getMe()}.
     */
    StrategyStep step(GameState state);
}
