package com.punter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main entry point for the punter AI.
 *
 * Features:
 * - Immutable graph snapshots with per-punter claim coloring
 * - Brute-force and minimax strategies
 * - Round-robin offline simulation ({@code punter.simulation.enabled=true})
 * - JSON codec for the game server messages
 */
@SpringBootApplication
public class PunterAIApplication {

    public static void main(String[] args) {
        SpringApplication.run(PunterAIApplication.class, args);
    }
}
