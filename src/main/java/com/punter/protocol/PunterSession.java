package com.punter.protocol;

import com.punter.exception.NotFoundException;
import com.punter.graph.Edge;
import com.punter.graph.Graph;
import com.punter.model.GameState;
import com.punter.model.Move;
import com.punter.model.PunterScore;
import com.punter.service.MapService;
import com.punter.strategy.Strategy;
import com.punter.strategy.StrategyStep;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Plays one game against a server with a single strategy.
 * <p>
 * Not thread-safe: a session handles the messages of one game, one at a time.
 */
@Slf4j
public class PunterSession {

    private final String name;
    private final Strategy strategy;
    private final MapService mapService;
    private final ProtocolCodec codec;

    private GameState state;
    private List<PunterScore> finalScores = List.of();

    public PunterSession(String name, Strategy strategy, MapService mapService, ProtocolCodec codec) {
        this.name = name;
        this.strategy = strategy;
        this.mapService = mapService;
        this.codec = codec;
    }

    /**
     * The opening message of the game.
     */
    public String handshake() {
        return codec.serialize(new MessageOut.HandshakeOut(name));
    }

    /**
     * Handle a raw server message and return the reply, if the message needs one.
     */
    public Optional<String> handle(String message) {
        return handle(codec.deserialize(message)).map(codec::serialize);
    }

    public Optional<MessageOut> handle(MessageIn message) {
        if (message instanceof MessageIn.Handshake handshake) {
            log.info("Server acknowledged punter '{}'", handshake.you());
            return Optional.empty();
        }
        if (message instanceof MessageIn.Setup setup) {
            return Optional.of(setup(setup));
        }
        if (message instanceof MessageIn.MoveRequest request) {
            return Optional.of(new MessageOut.MoveOut(move(request.moves())));
        }
        if (message instanceof MessageIn.Stop stop) {
            finalScores = List.copyOf(stop.scores());
            log.info("Game over for punter {}: {}", state == null ? "?" : state.getMe(), finalScores);
            return Optional.empty();
        }
        if (message instanceof MessageIn.Timeout timeout) {
            log.warn("Server timed out waiting for {} after {}s", name, timeout.timeout());
            return Optional.empty();
        }
        throw new IllegalArgumentException("Unsupported message: " + message);
    }

    private MessageOut setup(MessageIn.Setup setup) {
        Graph graph = mapService.buildGraph(setup.map());
        GameState initial = GameState.initial(graph, setup.punters()).withMe(setup.punter());
        state = initial.withStrategyState(strategy.initialize(graph));
        log.info("Punter {} of {} ready with {} on {}", setup.punter(), setup.punters(), strategy.getName(), graph);
        return new MessageOut.Ready(setup.punter());
    }

    private Move move(List<Move> moves) {
        if (state == null) {
            throw new IllegalStateException("Move requested before setup");
        }
        for (Move move : moves) {
            if (!alreadyApplied(move)) {
                state = state.applyMove(move);
            }
        }

        int me = state.getMe();
        if (!state.getGraph().hasUnclaimed()) {
            return Move.pass(me);
        }

        StrategyStep step = strategy.step(state);
        state = state.withStrategyState(step.state());
        Edge.Ends sites = state.getGraph().originalEnds(step.edge());
        return Move.claim(me, sites.source(), sites.target());
    }

    private boolean alreadyApplied(Move move) {
        if (!(move instanceof Move.Claim claim)) {
            return false;
        }
        Graph graph = state.getGraph();
        try {
            Edge edge = graph.fromOriginalEnds(claim.source(), claim.target());
            return graph.isClaimedBy(claim.punter(), edge);
        } catch (NotFoundException e) {
            // applyMove reports the unknown river
            return false;
        }
    }

    public Optional<GameState> getState() {
        return Optional.ofNullable(state);
    }

    public List<PunterScore> getFinalScores() {
        return finalScores;
    }
}
