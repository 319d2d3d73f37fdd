package com.punter.model;

/**
 * A punter's move: claim a river or pass.
 * Site identities are the map's ids, not internal vertex indices.
 */
public sealed interface Move permits Move.Claim, Move.Pass {

    int punter();

    static Move claim(int punter, int source, int target) {
        return new Claim(punter, source, target);
    }

    static Move pass(int punter) {
        return new Pass(punter);
    }

    record Claim(int punter, int source, int target) implements Move {}

    record Pass(int punter) implements Move {}
}
