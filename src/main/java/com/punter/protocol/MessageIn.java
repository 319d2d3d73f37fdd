package com.punter.protocol;

import com.punter.config.MapDefinition;
import com.punter.model.Move;
import com.punter.model.PunterScore;

import java.util.List;

/**
 * Messages a punter receives from the game server.
 */
public sealed interface MessageIn
        permits MessageIn.Handshake, MessageIn.Setup, MessageIn.MoveRequest, MessageIn.Stop, MessageIn.Timeout {

    /** Server acknowledges our name. */
    record Handshake(String you) implements MessageIn {}

    /** Game start: our punter id, number of punters and the map. */
    record Setup(int punter, int punters, MapDefinition map) implements MessageIn {}

    /** Our turn; carries the moves made since our last turn. */
    record MoveRequest(List<Move> moves) implements MessageIn {}

    /** Game over: the last moves and the final scores. */
    record Stop(List<Move> moves, List<PunterScore> scores) implements MessageIn {}

    /** We took too long to answer. */
    record Timeout(int timeout) implements MessageIn {}
}
