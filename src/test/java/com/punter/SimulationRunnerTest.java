package com.punter;

import com.punter.graph.Edge;
import com.punter.graph.Graph;
import com.punter.model.PunterScore;
import com.punter.model.SimulationResult;
import com.punter.service.MapService;
import com.punter.service.SimulationService;
import com.punter.strategy.LowestEdgeStrategy;
import com.punter.strategy.Strategy;
import com.punter.strategy.StrategyFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SimulationRunnerTest {

    @Mock private MapService mapService;
    @Mock private StrategyFactory strategyFactory;
    @Mock private SimulationService simulationService;

    @InjectMocks
    private SimulationRunner runner;

    private final Graph graph = Graph.create(2, List.of(0), List.of(new Edge.Ends(0, 1)));
    private final List<Strategy> strategies = List.of(new LowestEdgeStrategy(), new LowestEdgeStrategy());

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(runner, "mapName", "sample");
        ReflectionTestUtils.setField(runner, "competitors", List.of("lowest-edge", "lowest-edge"));
        when(strategyFactory.getStrategies(List.of("lowest-edge", "lowest-edge"))).thenReturn(strategies);
        when(simulationService.simulate(graph, strategies)).thenReturn(new SimulationResult(
                List.of(), graph, List.of(new PunterScore(0, 1), new PunterScore(1, 0))));
    }

    @Test
    @DisplayName("run() should simulate the configured map")
    void shouldUseConfiguredMap() {
        when(mapService.loadGraph("sample")).thenReturn(graph);

        runner.run(new DefaultApplicationArguments("--punter.simulation.enabled=true"));

        verify(mapService).loadGraph("sample");
        verify(simulationService).simulate(graph, strategies);
    }

    @Test
    @DisplayName("run() should let the first non-option argument override the map")
    void shouldUseArgumentMap() {
        when(mapService.loadGraph("maps/custom.json")).thenReturn(graph);

        runner.run(new DefaultApplicationArguments("--punter.simulation.enabled=true", "maps/custom.json"));

        verify(mapService).loadGraph("maps/custom.json");
        verify(mapService, never()).loadGraph("sample");
    }
}
