package com.punter.service;

import com.punter.exception.InvalidMoveException;
import com.punter.graph.Edge;
import com.punter.graph.Graph;
import com.punter.model.GameState;
import com.punter.model.Move;
import com.punter.model.PunterScore;
import com.punter.model.SimulationResult;
import com.punter.strategy.Strategy;
import com.punter.strategy.StrategyStep;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Plays strategies against each other in strict round robin until every river is claimed.
 * <p>
 * A strategy's position in the list is its punter id for the whole run. Turn {@code k} goes
 * to punter {@code k mod n}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SimulationService {

    private final ScoringService scoringService;

    /**
     * Simulate a full game and return the score of each strategy, in list order.
     */
    public List<Long> simulateScores(Graph graph, List<Strategy> strategies) {
        return simulate(graph, strategies).scoreValues();
    }

    /**
     * Simulate a full game.
     *
     * @throws IllegalArgumentException if {@code strategies} is empty
     * @throws InvalidMoveException     if a strategy picks a river that is not unclaimed
     */
    public SimulationResult simulate(Graph graph, List<Strategy> strategies) {
        if (strategies.isEmpty()) {
            throw new IllegalArgumentException("At least one strategy is required");
        }

        int punters = strategies.size();
        GameState state = GameState.initial(graph, punters);

        List<Map<String, String>> strategyStates = new ArrayList<>(punters);
        for (Strategy strategy : strategies) {
            strategyStates.add(strategy.initialize(graph));
        }

        int totalTurns = graph.edgeCount();
        List<Move> moves = new ArrayList<>(totalTurns);
        for (int turn = 0; turn < totalTurns; turn++) {
            int punter = turn % punters;
            Strategy strategy = strategies.get(punter);
            log.info("Step {}: {}", turn, strategy.getName());

            GameState perspective = state
                    .withMe(punter)
                    .withStrategyState(strategyStates.get(punter));
            StrategyStep step = strategy.step(perspective);
            Edge edge = validate(state.getGraph(), step, strategy, turn);

            Edge.Ends sites = state.getGraph().originalEnds(edge);
            Move.Claim claim = new Move.Claim(punter, sites.source(), sites.target());
            state = perspective.applyClaim(claim, step.state());
            strategyStates.set(punter, state.getStrategyState());
            moves.add(claim);
        }

        Graph finalGraph = state.getGraph();
        List<PunterScore> scores = scoringService.scoreAll(finalGraph, punters);
        log.info("Simulation finished after {} turns: {}", totalTurns, scores);
        return new SimulationResult(List.copyOf(moves), finalGraph, List.copyOf(scores));
    }

    private Edge validate(Graph graph, StrategyStep step, Strategy strategy, int turn) {
        Edge edge = step == null ? null : step.edge();
        if (edge == null) {
            throw new InvalidMoveException(strategy.getName() + " returned no river on turn " + turn);
        }
        if (!graph.contains(edge)) {
            throw new InvalidMoveException(strategy.getName() + " returned unknown river " + edge
                    + " on turn " + turn);
        }
        if (graph.isClaimed(edge)) {
            throw new InvalidMoveException(strategy.getName() + " returned river " + edge.id()
                    + " on turn " + turn + ", already claimed by punter " + graph.owner(edge.id()).getAsInt());
        }
        if (step.state() == null) {
            throw new InvalidMoveException(strategy.getName() + " returned no state on turn " + turn);
        }
        return edge;
    }
}
