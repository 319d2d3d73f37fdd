package com.punter.exception;

/**
 * Thrown when a map cannot be turned into a graph, e.g. a river or mine
 * references a site that does not exist.
 */
public class ConstructionException extends IllegalArgumentException {

    public ConstructionException(String message) {
        super(message);
    }
}
