package com.manufacturing.semanticlayer.service;

import com.manufacturing.semanticlayer.dto.JoinPath;
import com.manufacturing.semanticlayer.dto.JoinStep;
import com.manufacturing.semanticlayer.exception.NoPathException;
import com.manufacturing.semanticlayer.graph.GraphEdge;
import com.manufacturing.semanticlayer.graph.GraphModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Shortest join path between two tables over the undirected view of the
 * schema graph. Edge weight is the cost; a missing weight costs 1.
 *
 * <p>The path is always searched from the smaller table name to the larger
 * one and reversed when needed, so {@code (a, b)} and {@code (b, a)} yield the
 * same tables in opposite order. Among equal-cost paths the one whose node
 * sequence is lexicographically smallest in that canonical order wins; read
 * from a source that sorts after its target it need not be the smallest.
 *
 * <p>Stateless; safe to call concurrently on a sealed graph.
 */
@Service
@Slf4j
public class JoinPathResolver {

    private static final double EPSILON = 1e-9;

    public JoinPath resolve(GraphModel schemaGraph, String sourceTable, String targetTable) {
        schemaGraph.requireNode(sourceTable);
        schemaGraph.requireNode(targetTable);

        if (sourceTable.equals(targetTable)) {
            return JoinPath.builder()
                    .sourceTable(sourceTable)
                    .targetTable(targetTable)
                    .tables(List.of(sourceTable))
                    .steps(List.of())
                    .totalCost(0.0)
                    .build();
        }

        boolean flipped = sourceTable.compareTo(targetTable) > 0;
        String start = flipped ? targetTable : sourceTable;
        String end = flipped ? sourceTable : targetTable;

        List<String> tables = smallestShortestPath(schemaGraph, start, end);
        if (tables == null) {
            throw new NoPathException(sourceTable, targetTable);
        }
        if (flipped) {
            Collections.reverse(tables);
        }

        List<JoinStep> steps = new ArrayList<>(tables.size() - 1);
        double totalCost = 0.0;
        for (int i = 0; i + 1 < tables.size(); i++) {
            GraphEdge edge = cheapestEdge(schemaGraph, tables.get(i), tables.get(i + 1));
            steps.add(toStep(tables.get(i), tables.get(i + 1), edge));
            totalCost += cost(edge);
        }

        JoinPath path = JoinPath.builder()
                .sourceTable(sourceTable)
                .targetTable(targetTable)
                .tables(List.copyOf(tables))
                .steps(List.copyOf(steps))
                .totalCost(totalCost)
                .build();
        log.debug("Join path {} -> {}: {} (cost {})", sourceTable, targetTable, path.describe(), totalCost);
        return path;
    }

    /**
     * Dijkstra from {@code end}, then a greedy walk from {@code start} that
     * always takes the smallest neighbor still on a shortest path. Returns null
     * when {@code end} is unreachable.
     */
    private List<String> smallestShortestPath(GraphModel graph, String start, String end) {
        Map<String, Double> distance = distancesFrom(graph, end);
        if (!distance.containsKey(start)) {
            return null;
        }

        List<String> path = new ArrayList<>();
        String current = start;
        path.add(current);
        while (!current.equals(end)) {
            double remaining = distance.get(current);
            String next = null;
            for (String neighbor : graph.neighbors(current)) {
                Double neighborDistance = distance.get(neighbor);
                if (neighborDistance == null) {
                    continue;
                }
                double viaNeighbor = neighborDistance + cost(cheapestEdge(graph, current, neighbor));
                if (sameCost(viaNeighbor, remaining)) {
                    next = neighbor;
                    break;
                }
            }
            if (next == null) {
                throw new IllegalStateException("No shortest-path successor for " + current + " towards " + end);
            }
            path.add(next);
            current = next;
        }
        return path;
    }

    private Map<String, Double> distancesFrom(GraphModel graph, String origin) {
        Map<String, Double> distance = new HashMap<>();
        Set<String> settled = new HashSet<>();
        PriorityQueue<Map.Entry<String, Double>> queue = new PriorityQueue<>(
                Map.Entry.<String, Double>comparingByValue().thenComparing(Map.Entry.comparingByKey()));
        distance.put(origin, 0.0);
        queue.add(Map.entry(origin, 0.0));

        while (!queue.isEmpty()) {
            Map.Entry<String, Double> head = queue.poll();
            String node = head.getKey();
            if (!settled.add(node)) {
                continue;
            }
            for (String neighbor : graph.neighbors(node)) {
                if (settled.contains(neighbor)) {
                    continue;
                }
                double candidate = head.getValue() + cost(cheapestEdge(graph, node, neighbor));
                Double known = distance.get(neighbor);
                if (known == null || candidate < known) {
                    distance.put(neighbor, candidate);
                    queue.add(Map.entry(neighbor, candidate));
                }
            }
        }
        return distance;
    }

    /**
     * When both {@code a -> b} and {@code b -> a} exist the cheaper one is used;
     * on equal cost the edge pointing along the walk wins.
     */
    private static GraphEdge cheapestEdge(GraphModel graph, String a, String b) {
        Optional<GraphEdge> forward = graph.getDirectedEdge(a, b);
        Optional<GraphEdge> backward = graph.getDirectedEdge(b, a);
        if (forward.isPresent() && backward.isPresent()) {
            return cost(backward.get()) < cost(forward.get()) ? backward.get() : forward.get();
        }
        return forward.or(() -> backward)
                .orElseThrow(() -> new IllegalStateException("No edge between adjacent nodes " + a + " and " + b));
    }

    private static double cost(GraphEdge edge) {
        double weight = edge.weightOr(1.0);
        if (!(weight > 0.0)) {
            throw new IllegalStateException("Non-positive weight " + weight + " on edge "
                    + edge.getFrom() + " -> " + edge.getTo());
        }
        return weight;
    }

    private static boolean sameCost(double a, double b) {
        return Math.abs(a - b) <= EPSILON * Math.max(1.0, Math.max(Math.abs(a), Math.abs(b)));
    }

    private static JoinStep toStep(String from, String to, GraphEdge edge) {
        return JoinStep.builder()
                .from(from)
                .to(to)
                .edgeFrom(edge.getFrom())
                .edgeTo(edge.getTo())
                .reversed(!edge.getFrom().equals(from))
                .relationshipKind(edge.getRelationshipKind())
                .joinColumn(edge.getJoinColumn())
                .weight(cost(edge))
                .metadata(edge.getMetadata())
                .build();
    }
}
