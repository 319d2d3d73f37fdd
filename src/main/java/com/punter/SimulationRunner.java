package com.punter;

import com.punter.graph.Graph;
import com.punter.model.PunterScore;
import com.punter.model.SimulationResult;
import com.punter.service.MapService;
import com.punter.service.SimulationService;
import com.punter.strategy.Strategy;
import com.punter.strategy.StrategyFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs one offline simulation at startup.
 * The first non-option program argument, if any, names the map (built-in name or file path).
 */
@Component
@ConditionalOnProperty(prefix = "punter.simulation", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class SimulationRunner implements ApplicationRunner {

    private final MapService mapService;
    private final StrategyFactory strategyFactory;
    private final SimulationService simulationService;

    @Value("${punter.simulation.map:sample}")
    private String mapName;

    @Value("${punter.simulation.competitors:brute-force-1,brute-force-3,minimax}")
    private List<String> competitors;

    @Override
    public void run(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        String map = positional.isEmpty() ? mapName : positional.get(0);
        Graph graph = mapService.loadGraph(map);
        List<Strategy> strategies = strategyFactory.getStrategies(competitors);

        SimulationResult result = simulationService.simulate(graph, strategies);

        for (PunterScore score : result.scores()) {
            log.info("{} {}", strategies.get(score.punter()).getName(), score.score());
        }
    }
}
