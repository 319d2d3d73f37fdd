package com.punter.model;

/**
 * Final score of one punter.
 */
public record PunterScore(int punter, long score) {}
