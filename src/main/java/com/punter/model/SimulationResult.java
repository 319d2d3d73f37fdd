package com.punter.model;

import com.punter.graph.Graph;

import java.util.List;

/**
 * Outcome of a simulated game.
 *
 * @param moves      every claim, in turn order
 * @param finalGraph the fully claimed board
 * @param scores     one entry per punter, in punter order
 */
public record SimulationResult(List<Move> moves, Graph finalGraph, List<PunterScore> scores) {

    public List<Long> scoreValues() {
        return scores.stream().map(PunterScore::score).toList();
    }
}
