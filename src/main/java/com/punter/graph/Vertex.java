package com.punter.graph;

import java.util.Optional;

/**
 * A site on the map.
 *
 * @param id          identity as given in the map (not necessarily dense)
 * @param mine        whether this site is a scoring source
 * @param coordinates drawing position, {@code null} when the map has none
 */
public record Vertex(int id, boolean mine, Coordinates coordinates) {

    public Vertex(int id, boolean mine) {
        this(id, mine, null);
    }

    public Optional<Coordinates> coords() {
        return Optional.ofNullable(coordinates);
    }

    Vertex asMine(boolean isMine) {
        return isMine == mine ? this : new Vertex(id, isMine, coordinates);
    }

    /**
     * Presentation-only position of a site.
     */
    public record Coordinates(double x, double y) {}
}
