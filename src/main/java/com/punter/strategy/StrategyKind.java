package com.punter.strategy;

import java.util.Arrays;
import java.util.Optional;

/**
 * Available strategies, by configuration key.
 */
public enum StrategyKind {
    LOWEST_EDGE("lowest-edge"),
    RANDOM_EDGE("random-edge"),
    BRUTE_FORCE_1("brute-force-1"),
    BRUTE_FORCE_3("brute-force-3"),
    MINIMAX("minimax");

    private final String key;

    StrategyKind(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static Optional<StrategyKind> fromKey(String key) {
        return Arrays.stream(values())
                .filter(kind -> kind.key.equalsIgnoreCase(key == null ? "" : key.trim()))
                .findFirst();
    }
}
