package com.punter.exception;

/**
 * Thrown when a river that already has an owner is claimed again.
 */
public class AlreadyClaimedException extends IllegalStateException {

    private final int edgeId;
    private final int owner;

    public AlreadyClaimedException(int edgeId, int owner) {
        super("River " + edgeId + " is already claimed by punter " + owner);
        this.edgeId = edgeId;
        this.owner = owner;
    }

    public int getEdgeId() {
        return edgeId;
    }

    public int getOwner() {
        return owner;
    }
}
