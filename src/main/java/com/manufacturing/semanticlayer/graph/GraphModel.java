package com.manufacturing.semanticlayer.graph;

import com.manufacturing.semanticlayer.exception.DuplicateEdgeException;
import com.manufacturing.semanticlayer.exception.DuplicateNodeException;
import com.manufacturing.semanticlayer.exception.UnknownNodeException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * In-memory graph of typed nodes and directed, attributed edges.
 *
 * <p>Every collection is kept sorted by node id so iteration never depends on
 * insertion or hash order. A graph is populated once, then {@link #seal()}ed;
 * a sealed graph rejects mutation and is safe to share between threads for
 * reads. Rebuilding means constructing a new instance.
 *
 * <p>{@link #neighbors(String)} is the undirected view used for path search:
 * an edge {@code a -> b} makes each endpoint a neighbor of the other, while
 * {@link #getEdge(String, String)} still returns the edge with its own
 * direction.
 */
public class GraphModel {

    private final String name;
    private final boolean directed;

    private final NavigableMap<String, GraphNode> nodes = new TreeMap<>();
    private final NavigableMap<String, NavigableMap<String, GraphEdge>> outgoing = new TreeMap<>();
    private final NavigableMap<String, NavigableMap<String, GraphEdge>> incoming = new TreeMap<>();
    private final NavigableMap<String, NavigableSet<String>> adjacency = new TreeMap<>();
    private int edgeCount;

    private volatile boolean sealed;

    public GraphModel(String name, boolean directed) {
        this.name = name;
        this.directed = directed;
    }

    public static GraphModel directed(String name) {
        return new GraphModel(name, true);
    }

    public static GraphModel undirected(String name) {
        return new GraphModel(name, false);
    }

    public String getName() {
        return name;
    }

    public boolean isDirected() {
        return directed;
    }

    public boolean isSealed() {
        return sealed;
    }

    public GraphModel seal() {
        sealed = true;
        return this;
    }

    public void addNode(GraphNode node) {
        checkMutable();
        if (nodes.containsKey(node.getId())) {
            throw new DuplicateNodeException(node.getId());
        }
        nodes.put(node.getId(), node);
        outgoing.put(node.getId(), new TreeMap<>());
        incoming.put(node.getId(), new TreeMap<>());
        adjacency.put(node.getId(), new TreeSet<>());
    }

    public void addEdge(GraphEdge edge) {
        checkMutable();
        String from = edge.getFrom();
        String to = edge.getTo();
        if (!nodes.containsKey(from)) {
            throw new UnknownNodeException(from, "edge source of " + from + " -> " + to);
        }
        if (!nodes.containsKey(to)) {
            throw new UnknownNodeException(to, "edge target of " + from + " -> " + to);
        }
        if (outgoing.get(from).containsKey(to) || (!directed && outgoing.get(to).containsKey(from))) {
            throw new DuplicateEdgeException(from, to);
        }
        outgoing.get(from).put(to, edge);
        incoming.get(to).put(from, edge);
        adjacency.get(from).add(to);
        adjacency.get(to).add(from);
        edgeCount++;
    }

    public boolean containsNode(String id) {
        return nodes.containsKey(id);
    }

    public Optional<GraphNode> getNode(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public GraphNode requireNode(String id) {
        GraphNode node = nodes.get(id);
        if (node == null) {
            throw new UnknownNodeException(id, "graph '" + name + "'");
        }
        return node;
    }

    /**
     * Adjacent node ids in either direction, ascending.
     */
    public List<String> neighbors(String id) {
        NavigableSet<String> adjacent = adjacency.get(id);
        if (adjacent == null) {
            throw new UnknownNodeException(id, "graph '" + name + "'");
        }
        return List.copyOf(adjacent);
    }

    /**
     * The edge {@code a -> b} if present, otherwise {@code b -> a}, otherwise empty.
     */
    public Optional<GraphEdge> getEdge(String a, String b) {
        Optional<GraphEdge> forward = getDirectedEdge(a, b);
        return forward.isPresent() ? forward : getDirectedEdge(b, a);
    }

    public Optional<GraphEdge> getDirectedEdge(String from, String to) {
        NavigableMap<String, GraphEdge> out = outgoing.get(from);
        return out == null ? Optional.empty() : Optional.ofNullable(out.get(to));
    }

    public List<GraphEdge> outgoing(String id) {
        NavigableMap<String, GraphEdge> out = outgoing.get(id);
        return out == null ? List.of() : List.copyOf(out.values());
    }

    public List<GraphEdge> incoming(String id) {
        NavigableMap<String, GraphEdge> in = incoming.get(id);
        return in == null ? List.of() : List.copyOf(in.values());
    }

    public List<GraphNode> nodes() {
        return List.copyOf(nodes.values());
    }

    public List<GraphNode> nodes(NodeKind kind) {
        return nodes.values().stream()
                .filter(node -> node.getKind() == kind)
                .collect(Collectors.toList());
    }

    /**
     * All edges ordered by source id, then target id.
     */
    public List<GraphEdge> edges() {
        List<GraphEdge> all = new ArrayList<>(edgeCount);
        outgoing.values().forEach(out -> all.addAll(out.values()));
        return Collections.unmodifiableList(all);
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edgeCount;
    }

    public GraphSummary summary() {
        Map<NodeKind, Long> nodesByKind = new EnumMap<>(NodeKind.class);
        nodes.values().forEach(node -> nodesByKind.merge(node.getKind(), 1L, Long::sum));
        Map<EdgeType, Long> edgesByType = new EnumMap<>(EdgeType.class);
        edges().forEach(edge -> edgesByType.merge(edge.getType(), 1L, Long::sum));

        int n = nodes.size();
        double possible = n < 2 ? 0 : (double) n * (n - 1);
        double density = possible == 0 ? 0.0 : (directed ? edgeCount : 2.0 * edgeCount) / possible;

        return GraphSummary.builder()
                .name(name)
                .directed(directed)
                .nodeCount(n)
                .edgeCount(edgeCount)
                .nodesByKind(nodesByKind)
                .edgesByType(edgesByType)
                .connected(isWeaklyConnected())
                .density(density)
                .build();
    }

    private boolean isWeaklyConnected() {
        if (nodes.isEmpty()) {
            return false;
        }
        Set<String> seen = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(nodes.firstKey());
        seen.add(nodes.firstKey());
        while (!queue.isEmpty()) {
            for (String next : adjacency.get(queue.poll())) {
                if (seen.add(next)) {
                    queue.add(next);
                }
            }
        }
        return seen.size() == nodes.size();
    }

    private void checkMutable() {
        if (sealed) {
            throw new IllegalStateException("Graph '" + name + "' is sealed; rebuild it instead of mutating");
        }
    }

    @Override
    public String toString() {
        return "GraphModel{" + name + ", directed=" + directed
                + ", nodes=" + nodes.size() + ", edges=" + edgeCount + "}";
    }
}
