package com.punter.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A river between two sites, given by site id.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RiverDefinition(
        int source,
        int target
) {}
