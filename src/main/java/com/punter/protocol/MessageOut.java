package com.punter.protocol;

import com.punter.model.Move;

/**
 * Messages a punter sends to the game server.
 */
public sealed interface MessageOut
        permits MessageOut.HandshakeOut, MessageOut.Ready, MessageOut.MoveOut {

    record HandshakeOut(String me) implements MessageOut {}

    record Ready(int ready) implements MessageOut {}

    record MoveOut(Move move) implements MessageOut {}
}
