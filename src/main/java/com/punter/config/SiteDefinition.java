package com.punter.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A single site on the map.
 *
 * @param id site id, unique within the map but not necessarily dense
 * @param x  optional X coordinate for drawing
 * @param y  optional Y coordinate for drawing
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SiteDefinition(
        int id,
        Double x,
        Double y
) {}
