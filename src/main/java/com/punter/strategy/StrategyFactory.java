package com.punter.strategy;

import com.punter.service.ScoringService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;

/**
 * Factory for creating strategies by kind or configuration key.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StrategyFactory {

    private final ScoringService scoringService;

    @Value("${punter.strategy.brute-force-depth:1}")
    private int bruteForceDepth;

    @Value("${punter.strategy.deep-brute-force-depth:3}")
    private int deepBruteForceDepth;

    @Value("${punter.strategy.minimax-depth:3}")
    private int minimaxDepth;

    @Value("${punter.strategy.random-seed:42}")
    private long randomSeed;

    /**
     * Get a new strategy of the given kind.
     */
    public Strategy getStrategy(StrategyKind kind) {
        return switch (kind) {
            case LOWEST_EDGE -> new LowestEdgeStrategy();
            case RANDOM_EDGE -> new RandomEdgeStrategy(randomSeed);
            case BRUTE_FORCE_1 -> new BruteForceStrategy(kind.getKey(), bruteForceDepth, scoringService);
            case BRUTE_FORCE_3 -> new BruteForceStrategy(kind.getKey(), deepBruteForceDepth, scoringService);
            case MINIMAX -> new MinimaxStrategy(minimaxDepth, scoringService);
        };
    }

    /**
     * Get a new strategy by its configuration key, e.g. {@code "minimax"}.
     *
     * @throws IllegalArgumentException if the key is unknown
     */
    public Strategy getStrategy(String key) {
        return StrategyKind.fromKey(key)
                .map(this::getStrategy)
                .orElseThrow(() -> new IllegalArgumentException("Unknown strategy: " + key
                        + ". Available strategies: "
                        + Arrays.stream(StrategyKind.values()).map(StrategyKind::getKey).toList()));
    }

    /**
     * Build the competitor list for a game, in punter order.
     */
    public List<Strategy> getStrategies(List<String> keys) {
        List<Strategy> strategies = keys.stream().map(this::getStrategy).toList();
        log.info("Competitors: {}", strategies.stream().map(Strategy::getName).toList());
        return strategies;
    }
}
