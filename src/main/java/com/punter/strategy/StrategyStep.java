package com.punter.strategy;

import com.punter.graph.Edge;

import java.util.Map;

/**
 * A strategy's decision: the river to claim and its state for the next turn.
 */
public record StrategyStep(Edge edge, Map<String, String> state) {}
