package com.punter.model;

import com.punter.exception.AlreadyClaimedException;
import com.punter.exception.NotFoundException;
import com.punter.exception.UnknownEdgeException;
import com.punter.graph.Edge;
import com.punter.graph.Graph;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.Map;

/**
 * The board as seen by one punter, plus that punter's strategy state.
 * <p>
 * {@code strategyState} belongs to the strategy; the simulator hands it over and stores
 * whatever comes back without looking inside.
 */
@Value
@With
@Builder(toBuilder = true)
public class GameState {

    /** {@link #me} before any punter is acting. */
    public static final int NO_PERSPECTIVE = -1;

    Graph graph;

    int me;

    int punters;

    @Builder.Default
    Map<String, String> strategyState = Map.of();

    public static GameState initial(Graph graph, int punters) {
        return GameState.builder()
                .graph(graph)
                .me(NO_PERSPECTIVE)
                .punters(punters)
                .build();
    }

    public boolean hasPerspective() {
        return me != NO_PERSPECTIVE;
    }

    /** The punter who moves after {@code punter}. */
    public int nextPunter(int punter) {
        return (punter + 1) % Math.max(punters, 1);
    }

    /**
     * Applies a claim and replaces the strategy state.
     *
     * @throws UnknownEdgeException    if no river joins the claim's sites
     * @throws AlreadyClaimedException if that river is already owned
     */
    public GameState applyClaim(Move.Claim claim, Map<String, String> newStrategyState) {
        Edge edge;
        try {
            edge = graph.fromOriginalEnds(claim.source(), claim.target());
        } catch (NotFoundException e) {
            throw new UnknownEdgeException("Punter " + claim.punter() + " claimed a river that does not exist: "
                    + claim.source() + " - " + claim.target(), e);
        }
        return toBuilder()
                .graph(graph.claim(claim.punter(), edge.id()))
                .strategyState(Map.copyOf(newStrategyState))
                .build();
    }

    /**
     * Applies a move reported by the game server. Passes leave the board unchanged.
     */
    public GameState applyMove(Move move) {
        if (move instanceof Move.Claim claim) {
            return applyClaim(claim, strategyState);
        }
        return this;
    }
}
