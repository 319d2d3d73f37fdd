package com.punter.model;

import com.punter.exception.AlreadyClaimedException;
import com.punter.exception.UnknownEdgeException;
import com.punter.graph.Edge;
import com.punter.graph.Graph;
import com.punter.graph.Vertex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for GameState: claim application and strategy state hand-over.
 */
class GameStateTest {

    private GameState state;

    @BeforeEach
    void setUp() {
        Graph graph = Graph.fromOriginal(
                List.of(new Vertex(10, false), new Vertex(20, false), new Vertex(30, false)),
                List.of(10),
                List.of(new Edge.Ends(10, 20), new Edge.Ends(20, 30)));
        state = GameState.initial(graph, 2);
    }

    @Test
    @DisplayName("initial state should have no perspective and empty strategy state")
    void shouldStartWithoutPerspective() {
        assertFalse(state.hasPerspective());
        assertEquals(GameState.NO_PERSPECTIVE, state.getMe());
        assertEquals(2, state.getPunters());
        assertTrue(state.getStrategyState().isEmpty());
    }

    @Test
    @DisplayName("applyClaim should claim the river by site ids and replace the strategy state")
    void shouldApplyClaim() {
        GameState next = state.applyClaim(new Move.Claim(1, 30, 20), Map.of("turn", "1"));

        assertEquals(Map.of(1, 1), next.getGraph().coloring());
        assertEquals(Map.of("turn", "1"), next.getStrategyState());
        assertTrue(state.getGraph().coloring().isEmpty(), "Previous state must not change");
    }

    @Test
    @DisplayName("applyClaim should throw when no river joins the sites")
    void shouldRejectUnknownRiver() {
        assertThrows(UnknownEdgeException.class,
                () -> state.applyClaim(new Move.Claim(0, 10, 30), Map.of()));
        assertThrows(UnknownEdgeException.class,
                () -> state.applyClaim(new Move.Claim(0, 10, 99), Map.of()));
    }

    @Test
    @DisplayName("applyClaim should throw when the river is already owned")
    void shouldRejectReclaim() {
        GameState claimed = state.applyClaim(new Move.Claim(0, 10, 20), Map.of());

        assertThrows(AlreadyClaimedException.class,
                () -> claimed.applyClaim(new Move.Claim(1, 20, 10), Map.of()));
    }

    @Test
    @DisplayName("applyMove should leave the board unchanged for a pass")
    void shouldIgnorePass() {
        assertSame(state, state.applyMove(Move.pass(0)));
    }

    @Test
    @DisplayName("applyMove should apply a claim and keep the strategy state")
    void shouldApplyClaimMove() {
        GameState withState = state.withStrategyState(Map.of("k", "v"));

        GameState next = withState.applyMove(Move.claim(0, 10, 20));

        assertTrue(next.getGraph().isClaimedBy(0, next.getGraph().edge(0)));
        assertEquals(Map.of("k", "v"), next.getStrategyState());
    }

    @Test
    @DisplayName("nextPunter should wrap around")
    void shouldRotatePunters() {
        assertEquals(1, state.nextPunter(0));
        assertEquals(0, state.nextPunter(1));
        assertEquals(2, state.withPunters(3).nextPunter(1));
        assertEquals(0, state.withPunters(1).nextPunter(0));
    }
}
