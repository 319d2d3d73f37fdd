package com.punter.strategy;

import com.punter.graph.Edge;
import com.punter.graph.Graph;
import com.punter.model.GameState;
import com.punter.service.ScoringService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MinimaxStrategy: paranoid search where every opponent minimizes our score.
 */
class MinimaxStrategyTest {

    private final ScoringService scoringService = new ScoringService();

    private static GameState stateFor(Graph graph, int me, int punters) {
        return GameState.builder().graph(graph).me(me).punters(punters).build();
    }

    /** Mine 0 with rivers 0-1, 0-2 and 2-3. */
    private static Graph fork() {
        return Graph.create(4, List.of(0), List.of(
                new Edge.Ends(0, 1), new Edge.Ends(0, 2), new Edge.Ends(2, 3)));
    }

    @Test
    @DisplayName("getName() should return the minimax key")
    void shouldReturnName() {
        assertEquals("minimax", new MinimaxStrategy(3, scoringService).getName());
    }

    @Test
    @DisplayName("should reject a depth below 1")
    void shouldRejectInvalidDepth() {
        assertThrows(IllegalArgumentException.class, () -> new MinimaxStrategy(0, scoringService));
    }

    @Test
    @DisplayName("depth 1 should claim the river at the mine even when listed last")
    void shouldClaimRiverAtMine() {
        Graph g = Graph.create(4, List.of(0), List.of(new Edge.Ends(2, 3), new Edge.Ends(0, 1)));

        StrategyStep step = new MinimaxStrategy(1, scoringService).step(stateFor(g, 0, 2));

        assertEquals(1, step.edge().id());
    }

    @Test
    @DisplayName("depth 1 should keep the lowest river id among equal scores")
    void shouldBreakTiesByLowestId() {
        StrategyStep step = new MinimaxStrategy(1, scoringService).step(stateFor(fork(), 0, 2));

        assertEquals(0, step.edge().id());
    }

    @Test
    @DisplayName("depth 3 should pick the river whose worst case is best")
    void shouldMaximizeWorstCase() {
        // 0-1 first: opponent leaves us 1. 0-2 first: opponent can hold us to 2.
        StrategyStep step = new MinimaxStrategy(3, scoringService).step(stateFor(fork(), 0, 2));

        assertEquals(1, step.edge().id());
    }

    @Test
    @DisplayName("should model each of several opponents in turn")
    void shouldModelSeveralOpponents() {
        // With two opponents moving before our next turn, both other rivers are gone: any first
        // claim at the mine is worth 1, so the lowest id wins.
        StrategyStep step = new MinimaxStrategy(3, scoringService).step(stateFor(fork(), 0, 3));

        assertEquals(0, step.edge().id());
    }

    @Test
    @DisplayName("should return the strategy state unchanged")
    void shouldPassStateThrough() {
        GameState state = stateFor(fork(), 0, 2).withStrategyState(Map.of("k", "v"));

        StrategyStep step = new MinimaxStrategy(2, scoringService).step(state);

        assertEquals(Map.of("k", "v"), step.state());
    }

    @Test
    @DisplayName("should refuse to move without an acting punter or without rivers")
    void shouldRejectInvalidStates() {
        MinimaxStrategy strategy = new MinimaxStrategy(2, scoringService);
        Graph claimed = fork().claim(0, 0).claim(1, 1).claim(0, 2);

        assertThrows(IllegalStateException.class, () -> strategy.step(GameState.initial(fork(), 2)));
        assertThrows(IllegalStateException.class, () -> strategy.step(stateFor(claimed, 0, 2)));
    }
}
