package com.punter.exception;

/**
 * Thrown when a claim names a source/target pair that no river connects.
 */
public class UnknownEdgeException extends IllegalArgumentException {

    public UnknownEdgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
