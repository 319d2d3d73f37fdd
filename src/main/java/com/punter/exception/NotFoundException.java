package com.punter.exception;

/**
 * Thrown when no vertex or edge matches the requested identity.
 */
public class NotFoundException extends IllegalArgumentException {

    public NotFoundException(String message) {
        super(message);
    }
}
