package com.punter.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Root definition of a playable map, loaded from JSON or received in a setup message.
 *
 * @param sites  every site on the map
 * @param rivers the claimable rivers, in river id order
 * @param mines  ids of the sites that are mines
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MapDefinition(
        List<SiteDefinition> sites,
        List<RiverDefinition> rivers,
        List<Integer> mines
) {

    public MapDefinition {
        sites = sites == null ? List.of() : List.copyOf(sites);
        rivers = rivers == null ? List.of() : List.copyOf(rivers);
        mines = mines == null ? List.of() : List.copyOf(mines);
    }
}
