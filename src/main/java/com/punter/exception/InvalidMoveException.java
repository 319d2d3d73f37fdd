package com.punter.exception;

/**
 * Thrown when a strategy returns a river that is not in the unclaimed set.
 * Aborts the simulation run.
 */
public class InvalidMoveException extends IllegalStateException {

    public InvalidMoveException(String message) {
        super(message);
    }
}
