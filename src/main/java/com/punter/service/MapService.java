package com.punter.service;

import com.punter.config.MapDefinition;
import com.punter.config.MapLoader;
import com.punter.config.SiteDefinition;
import com.punter.graph.Edge;
import com.punter.graph.Graph;
import com.punter.graph.Vertex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Service for building game graphs from {@link MapDefinition}s.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MapService {

    private final MapLoader mapLoader;

    /**
     * Build the graph for a loaded map name or a map file path.
     */
    public Graph loadGraph(String nameOrPath) {
        Graph graph = buildGraph(mapLoader.resolve(nameOrPath));
        log.info("Map '{}' ready: {}", nameOrPath, graph);
        return graph;
    }

    /**
     * Build a graph from a map definition. Site ids are remapped to dense vertex indices.
     *
     * @throws com.punter.exception.ConstructionException if a river or mine references an unknown site
     */
    public Graph buildGraph(MapDefinition map) {
        List<Vertex> sites = map.sites().stream()
                .map(MapService::toVertex)
                .toList();
        List<Edge.Ends> rivers = map.rivers().stream()
                .map(river -> new Edge.Ends(river.source(), river.target()))
                .toList();
        return Graph.fromOriginal(sites, map.mines(), rivers);
    }

    private static Vertex toVertex(SiteDefinition site) {
        Vertex.Coordinates coordinates = site.x() != null && site.y() != null
                ? new Vertex.Coordinates(site.x(), site.y())
                : null;
        return new Vertex(site.id(), false, coordinates);
    }
}
