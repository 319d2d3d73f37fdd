package com.punter.graph;

import com.punter.exception.AlreadyClaimedException;
import com.punter.exception.ConstructionException;
import com.punter.exception.NotFoundException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.IntStream;

/**
 * Immutable snapshot of the game board: sites, mines, rivers and the claim coloring.
 * <p>
 * Vertices are addressed by their dense internal index (position in {@link #vertices()}),
 * rivers by their id (position in the map's river list). Every {@link #claim} and
 * {@link #subgraph} returns a new snapshot; the receiver is never changed. Snapshots share
 * the vertex list and, when the edge set is unchanged, the adjacency index, and only copy
 * the ownership table.
 */
public final class Graph {

    private static final int NO_OWNER = -1;

    private final List<Vertex> vertices;
    private final Set<Integer> mines;
    private final Map<Integer, Integer> indexById;

    /** One slot per river id, {@code null} where this snapshot filtered the river out. */
    private final Edge[] arena;
    private final List<Edge> edges;
    private final List<List<Edge>> incident;
    private final int[] owners;

    private Graph(List<Vertex> vertices, Set<Integer> mines, Map<Integer, Integer> indexById,
                  Edge[] arena, List<Edge> edges, List<List<Edge>> incident, int[] owners) {
        this.vertices = vertices;
        this.mines = mines;
        this.indexById = indexById;
        this.arena = arena;
        this.edges = edges;
        this.incident = incident;
        this.owners = owners;
    }

    // ── construction ────────────────────────────────────────────────────

    /**
     * Builds a graph whose vertex ids are {@code 0..vertexCount-1}.
     *
     * @param vertexCount number of sites
     * @param mineIndices indices of the sites that are mines
     * @param ends        river ends, in river id order
     * @throws ConstructionException if a mine or river references a vertex out of range, or two rivers
     *                               join the same pair of vertices
     */
    public static Graph create(int vertexCount, Collection<Integer> mineIndices, List<Edge.Ends> ends) {
        if (vertexCount < 0) {
            throw new ConstructionException("Vertex count must not be negative: " + vertexCount);
        }
        List<Vertex> sites = IntStream.range(0, vertexCount)
                .mapToObj(i -> new Vertex(i, false))
                .toList();
        return build(sites, mineIndices, ends);
    }

    /**
     * Builds a graph from a map whose site ids may be sparse. Mines and river ends are given
     * as site ids and are remapped to dense internal indices.
     *
     * @throws ConstructionException on duplicate site ids or rivers, or a mine or river end naming an unknown site
     */
    public static Graph fromOriginal(List<Vertex> sites, Collection<Integer> mineIds, List<Edge.Ends> riverEnds) {
        Map<Integer, Integer> indexById = indexSites(sites);

        List<Integer> mineIndices = new ArrayList<>(mineIds.size());
        for (Integer mineId : mineIds) {
            mineIndices.add(resolveSite(indexById, mineId, "Mine"));
        }

        List<Edge.Ends> ends = new ArrayList<>(riverEnds.size());
        for (Edge.Ends river : riverEnds) {
            ends.add(new Edge.Ends(
                    resolveSite(indexById, river.source(), "River source"),
                    resolveSite(indexById, river.target(), "River target")));
        }
        return build(sites, mineIndices, ends);
    }

    private static Graph build(List<Vertex> sites, Collection<Integer> mineIndices, List<Edge.Ends> ends) {
        int n = sites.size();
        Map<Integer, Integer> indexById = indexSites(sites);

        Set<Integer> mines = new TreeSet<>();
        for (Integer mine : mineIndices) {
            if (mine == null || mine < 0 || mine >= n) {
                throw new ConstructionException("Mine " + mine + " is not a vertex (0.." + (n - 1) + ")");
            }
            mines.add(mine);
        }

        List<Vertex> vertices = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            vertices.add(sites.get(i).asMine(mines.contains(i)));
        }

        Edge[] arena = new Edge[ends.size()];
        Map<Edge.Ends, Integer> idByEnds = new HashMap<>();
        for (int id = 0; id < arena.length; id++) {
            Edge.Ends pair = ends.get(id);
            if (pair.source() < 0 || pair.source() >= n || pair.target() < 0 || pair.target() >= n) {
                throw new ConstructionException("River " + id + " (" + pair.source() + ", " + pair.target()
                        + ") references a vertex outside 0.." + (n - 1));
            }
            arena[id] = Edge.between(id, pair.source(), pair.target());
            // a river is addressed by its two sites, so each pair may appear once
            Integer previous = idByEnds.putIfAbsent(arena[id].ends(), id);
            if (previous != null) {
                throw new ConstructionException("River " + id + " (" + pair.source() + ", " + pair.target()
                        + ") duplicates river " + previous);
            }
        }

        int[] owners = new int[arena.length];
        Arrays.fill(owners, NO_OWNER);

        return new Graph(List.copyOf(vertices), Collections.unmodifiableSet(mines), Map.copyOf(indexById),
                arena, listEdges(arena), indexIncident(arena, n), owners);
    }

    private static Map<Integer, Integer> indexSites(List<Vertex> sites) {
        Map<Integer, Integer> indexById = new HashMap<>();
        for (int i = 0; i < sites.size(); i++) {
            Integer previous = indexById.put(sites.get(i).id(), i);
            if (previous != null) {
                throw new ConstructionException("Duplicate site id: " + sites.get(i).id());
            }
        }
        return indexById;
    }

    private static int resolveSite(Map<Integer, Integer> indexById, Integer siteId, String what) {
        Integer index = siteId == null ? null : indexById.get(siteId);
        if (index == null) {
            throw new ConstructionException(what + " references unknown site " + siteId);
        }
        return index;
    }

    private static List<Edge> listEdges(Edge[] arena) {
        List<Edge> present = new ArrayList<>();
        for (Edge edge : arena) {
            if (edge != null) {
                present.add(edge);
            }
        }
        return Collections.unmodifiableList(present);
    }

    private static List<List<Edge>> indexIncident(Edge[] arena, int vertexCount) {
        List<List<Edge>> incident = new ArrayList<>(vertexCount);
        for (int i = 0; i < vertexCount; i++) {
            incident.add(new ArrayList<>());
        }
        for (Edge edge : arena) {
            if (edge == null) {
                continue;
            }
            incident.get(edge.u()).add(edge);
            if (edge.v() != edge.u()) {
                incident.get(edge.v()).add(edge);
            }
        }
        return incident.stream().map(Collections::unmodifiableList).toList();
    }

    // ── structure ───────────────────────────────────────────────────────

    public List<Vertex> vertices() {
        return vertices;
    }

    /** Internal indices of the mine vertices, ascending. */
    public Set<Integer> mines() {
        return mines;
    }

    /** Rivers present in this snapshot, in id order. */
    public List<Edge> edges() {
        return edges;
    }

    public int vertexCount() {
        return vertices.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public Vertex vertex(int index) {
        checkVertex(index);
        return vertices.get(index);
    }

    /**
     * @throws NotFoundException if no river with this id is part of this snapshot
     */
    public Edge edge(int edgeId) {
        if (edgeId < 0 || edgeId >= arena.length || arena[edgeId] == null) {
            throw new NotFoundException("No river with id " + edgeId);
        }
        return arena[edgeId];
    }

    public boolean contains(Edge edge) {
        return edge != null && edge.id() >= 0 && edge.id() < arena.length && edge.equals(arena[edge.id()]);
    }

    /** Vertices one river away from {@code vertex}, whoever owns the river. */
    public List<Integer> adjacent(int vertex) {
        return adjacentEdges(vertex).stream()
                .map(edge -> edge.opposite(vertex))
                .toList();
    }

    public List<Edge> adjacentEdges(int vertex) {
        checkVertex(vertex);
        return incident.get(vertex);
    }

    // ── coloring ────────────────────────────────────────────────────────

    /** Rivers without an owner, in id order. */
    public List<Edge> unclaimed() {
        return edges.stream()
                .filter(edge -> owners[edge.id()] == NO_OWNER)
                .toList();
    }

    public boolean hasUnclaimed() {
        return edges.stream().anyMatch(edge -> owners[edge.id()] == NO_OWNER);
    }

    public OptionalInt owner(int edgeId) {
        Edge edge = edge(edgeId);
        int owner = owners[edge.id()];
        return owner == NO_OWNER ? OptionalInt.empty() : OptionalInt.of(owner);
    }

    public boolean isClaimed(Edge edge) {
        return owner(edge.id()).isPresent();
    }

    public boolean isClaimedBy(int punter, Edge edge) {
        OptionalInt owner = owner(edge.id());
        return owner.isPresent() && owner.getAsInt() == punter;
    }

    public List<Edge> ownedBy(int punter) {
        return edges.stream()
                .filter(edge -> owners[edge.id()] == punter)
                .toList();
    }

    /** Read-only view of river id to owning punter, for claimed rivers only. */
    public Map<Integer, Integer> coloring() {
        Map<Integer, Integer> coloring = new LinkedHashMap<>();
        for (Edge edge : edges) {
            if (owners[edge.id()] != NO_OWNER) {
                coloring.put(edge.id(), owners[edge.id()]);
            }
        }
        return Collections.unmodifiableMap(coloring);
    }

    /**
     * Returns a new snapshot in which {@code punter} owns river {@code edgeId}.
     *
     * @throws NotFoundException       if the river is not part of this snapshot
     * @throws AlreadyClaimedException if the river already has an owner
     */
    public Graph claim(int punter, int edgeId) {
        if (punter < 0) {
            throw new IllegalArgumentException("Punter must not be negative: " + punter);
        }
        Edge edge = edge(edgeId);
        if (owners[edge.id()] != NO_OWNER) {
            throw new AlreadyClaimedException(edge.id(), owners[edge.id()]);
        }
        int[] claimed = owners.clone();
        claimed[edge.id()] = punter;
        return new Graph(vertices, mines, indexById, arena, edges, incident, claimed);
    }

    /**
     * Restricts this snapshot to the rivers owned by {@code punter}. Vertices and mines are kept.
     */
    public Graph subgraph(int punter) {
        Edge[] kept = new Edge[arena.length];
        int[] keptOwners = new int[arena.length];
        Arrays.fill(keptOwners, NO_OWNER);
        for (Edge edge : edges) {
            if (owners[edge.id()] == punter) {
                kept[edge.id()] = edge;
                keptOwners[edge.id()] = punter;
            }
        }
        return new Graph(vertices, mines, indexById, kept, listEdges(kept),
                indexIncident(kept, vertices.size()), keptOwners);
    }

    // ── map ids ─────────────────────────────────────────────────────────

    /**
     * @throws NotFoundException if no site has this map id
     */
    public int vertexIndex(int siteId) {
        Integer index = indexById.get(siteId);
        if (index == null) {
            throw new NotFoundException("No site with id " + siteId);
        }
        return index;
    }

    /**
     * Finds the river joining two sites given by their map ids, in either order.
     *
     * @throws NotFoundException if either site is unknown or no river joins them
     */
    public Edge fromOriginalEnds(int source, int target) {
        int u = vertexIndex(source);
        int v = vertexIndex(target);
        return incident.get(u).stream()
                .filter(edge -> edge.connects(u, v))
                .findFirst()
                .orElseThrow(() -> new NotFoundException("No river between sites " + source + " and " + target));
    }

    public Edge fromOriginalEnds(Edge.Ends siteEnds) {
        return fromOriginalEnds(siteEnds.source(), siteEnds.target());
    }

    /**
     * The map ids of the sites a river joins, lower internal index first.
     *
     * @throws NotFoundException if the edge is not part of this snapshot
     */
    public Edge.Ends originalEnds(Edge edge) {
        if (!contains(edge)) {
            throw new NotFoundException("River " + edge + " is not part of this graph");
        }
        return new Edge.Ends(vertices.get(edge.u()).id(), vertices.get(edge.v()).id());
    }

    private void checkVertex(int index) {
        if (index < 0 || index >= vertices.size()) {
            throw new NotFoundException("No vertex with index " + index);
        }
    }

    @Override
    public String toString() {
        return "Graph{vertices=" + vertices.size() + ", mines=" + mines + ", edges=" + edges.size()
                + ", claimed=" + coloring().size() + "}";
    }
}
