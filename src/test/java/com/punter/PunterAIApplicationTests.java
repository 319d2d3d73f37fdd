package com.punter;

import com.punter.config.MapLoader;
import com.punter.strategy.StrategyFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class PunterAIApplicationTests {

    @Autowired
    private ApplicationContext context;

    @Test
    void contextLoads() {
        assertTrue(context.getBean(MapLoader.class).getAvailableMaps().contains("sample"));
        assertNotNull(context.getBean(StrategyFactory.class).getStrategy("minimax"));
        assertTrue(context.getBeansOfType(SimulationRunner.class).isEmpty(), "Simulation is off by default");
    }

    @Test
    void mainMethodRunsSimulation() {
        PunterAIApplication.main(new String[]{
                "--punter.simulation.enabled=true",
                "--punter.simulation.competitors=lowest-edge,random-edge,brute-force-1",
                "sample"});
    }
}
