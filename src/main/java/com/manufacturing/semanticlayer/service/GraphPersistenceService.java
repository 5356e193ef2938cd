package com.manufacturing.semanticlayer.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.manufacturing.semanticlayer.exception.GraphAlreadyExistsException;
import com.manufacturing.semanticlayer.exception.GraphNotFoundException;
import com.manufacturing.semanticlayer.exception.OperationCancelledException;
import com.manufacturing.semanticlayer.exception.PartialWriteException;
import com.manufacturing.semanticlayer.exception.StoreUnavailableException;
import com.manufacturing.semanticlayer.graph.GraphEdge;
import com.manufacturing.semanticlayer.graph.GraphModel;
import com.manufacturing.semanticlayer.graph.GraphNode;
import com.manufacturing.semanticlayer.store.GraphStore;
import com.manufacturing.semanticlayer.store.StoredEdge;
import com.manufacturing.semanticlayer.store.StoredGraph;
import com.manufacturing.semanticlayer.store.StoredGraphInfo;
import com.manufacturing.semanticlayer.store.StoredNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Exports graphs to the {@link GraphStore} and imports them back.
 *
 * <p>A persist writes the whole graph under a staging name and only then
 * promotes it over the target, so a failure or cancellation at any point
 * leaves a previously stored graph of the same name untouched. Store names
 * ending in {@value #STAGING_SUFFIX} are reserved for staging and rejected.
 * Overwrites of one store name must not run concurrently; callers serialize
 * them.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class GraphPersistenceService {

    static final String STAGING_SUFFIX = "__staging";

    private final GraphStore graphStore;
    private final ObjectMapper objectMapper;

    public StoredGraphInfo persist(GraphModel graph, String storeName, int batchSize, boolean overwrite,
                                   OperationDeadline deadline) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive, got " + batchSize);
        }
        checkStoreName(storeName);
        long startTime = System.currentTimeMillis();
        deadline.checkpoint("persist of '" + storeName + "'");

        if (graphStore.find(storeName).isPresent() && !overwrite) {
            throw new GraphAlreadyExistsException(storeName);
        }

        String stagingName = storeName + STAGING_SUFFIX;
        // leftover of an earlier interrupted run
        graphStore.drop(stagingName);

        List<StoredNode> nodes = toStoredNodes(graph);
        Map<String, String> keys = new HashMap<>();
        nodes.forEach(node -> keys.put(node.getLabel(), node.getKey()));
        List<StoredEdge> edges = toStoredEdges(graph, keys);

        graphStore.create(StoredGraphInfo.builder()
                .storeName(stagingName)
                .graphName(graph.getName())
                .directed(graph.isDirected())
                .nodeCount(nodes.size())
                .edgeCount(edges.size())
                .persistedAt(Instant.now())
                .build());

        try {
            writeInBatches(storeName, stagingName, "nodes", nodes, batchSize, deadline,
                    batch -> graphStore.writeNodes(stagingName, batch));
            writeInBatches(storeName, stagingName, "edges", edges, batchSize, deadline,
                    batch -> graphStore.writeEdges(stagingName, batch));
            deadline.checkpoint("promotion of '" + storeName + "'");
        } catch (RuntimeException e) {
            discardStaging(stagingName, e);
            throw e;
        }

        StoredGraphInfo stored;
        try {
            stored = graphStore.promote(stagingName, storeName);
        } catch (StoreUnavailableException e) {
            discardStaging(stagingName, e);
            throw e;
        } catch (RuntimeException e) {
            discardStaging(stagingName, e);
            throw new PartialWriteException(storeName, "promote", 0, e);
        }

        log.info("Persisted graph '{}' as '{}': {} nodes, {} edges in {}ms",
                graph.getName(), storeName, nodes.size(), edges.size(), System.currentTimeMillis() - startTime);
        return stored;
    }

    /**
     * Rebuilds a sealed graph from the store. With {@code directed = false} a
     * stored edge whose reverse was already added is skipped.
     */
    public GraphModel load(String storeName, boolean directed, OperationDeadline deadline) {
        checkStoreName(storeName);
        long startTime = System.currentTimeMillis();
        deadline.checkpoint("load of '" + storeName + "'");
        StoredGraph stored = graphStore.read(storeName)
                .orElseThrow(() -> new GraphNotFoundException(storeName));
        deadline.checkpoint("rebuild of '" + storeName + "'");

        String graphName = stored.getInfo().getGraphName() != null ? stored.getInfo().getGraphName() : storeName;
        GraphModel graph = new GraphModel(graphName, directed);
        for (StoredNode node : stored.getNodes()) {
            graph.addNode(fromJson(node.getAttributes(), GraphNode.class, storeName));
        }
        for (StoredEdge storedEdge : stored.getEdges()) {
            GraphEdge edge = fromJson(storedEdge.getAttributes(), GraphEdge.class, storeName);
            if (!directed && graph.getEdge(edge.getTo(), edge.getFrom()).isPresent()) {
                log.warn("Undirected load of '{}' skips {} -> {}: already connected by {}",
                        storeName, edge.getFrom(), edge.getTo(),
                        graph.getEdge(edge.getTo(), edge.getFrom()).get().getType());
                continue;
            }
            graph.addEdge(edge);
        }

        log.info("Loaded graph '{}' ({}) from store: {} nodes, {} edges in {}ms", storeName,
                directed ? "directed" : "undirected", graph.nodeCount(), graph.edgeCount(),
                System.currentTimeMillis() - startTime);
        return graph.seal();
    }

    private static void checkStoreName(String storeName) {
        if (storeName == null || storeName.isBlank()) {
            throw new IllegalArgumentException("Store name must not be blank");
        }
        if (storeName.endsWith(STAGING_SUFFIX)) {
            throw new IllegalArgumentException("Store name '" + storeName + "' ends in the reserved suffix '"
                    + STAGING_SUFFIX + "'");
        }
    }

    private <T> void writeInBatches(String storeName, String stagingName, String phase, List<T> items,
                                    int batchSize, OperationDeadline deadline, Consumer<List<T>> writer) {
        for (int start = 0, batchIndex = 0; start < items.size(); start += batchSize, batchIndex++) {
            deadline.checkpoint(phase + " batch " + batchIndex + " of '" + storeName + "'");
            List<T> batch = items.subList(start, Math.min(start + batchSize, items.size()));
            try {
                writer.accept(batch);
            } catch (OperationCancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("Writing {} batch {} of '{}' failed: {}", phase, batchIndex, stagingName, e.getMessage());
                throw new PartialWriteException(storeName, phase, batchIndex, e);
            }
            log.debug("Wrote {} batch {} ({} items) of '{}'", phase, batchIndex, batch.size(), stagingName);
        }
    }

    private void discardStaging(String stagingName, RuntimeException cause) {
        try {
            graphStore.drop(stagingName);
        } catch (RuntimeException dropFailure) {
            cause.addSuppressed(dropFailure);
            log.warn("Could not drop staging graph '{}' after failed persist: {}", stagingName,
                    dropFailure.getMessage());
        }
    }

    private List<StoredNode> toStoredNodes(GraphModel graph) {
        List<StoredNode> nodes = new ArrayList<>(graph.nodeCount());
        Set<String> usedKeys = new HashSet<>();
        for (GraphNode node : graph.nodes()) {
            nodes.add(new StoredNode(uniqueKey(node.getId(), usedKeys), node.getId(),
                    node.getKind().name(), toJson(node)));
        }
        return nodes;
    }

    private List<StoredEdge> toStoredEdges(GraphModel graph, Map<String, String> keys) {
        List<StoredEdge> edges = new ArrayList<>(graph.edgeCount());
        for (GraphEdge edge : graph.edges()) {
            edges.add(new StoredEdge(keys.get(edge.getFrom()), keys.get(edge.getTo()),
                    edge.getType().name(), toJson(edge)));
        }
        return edges;
    }

    /**
     * Store-safe key: letters, digits and underscores only, suffixed when two
     * ids collapse to the same key.
     */
    static String uniqueKey(String nodeId, Set<String> usedKeys) {
        String base = nodeId.replaceAll("[^A-Za-z0-9_]", "_");
        String key = base;
        for (int n = 2; !usedKeys.add(key); n++) {
            key = base + "_" + n;
        }
        return key;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + value, e);
        }
    }

    private <T> T fromJson(String json, Class<T> type, String storeName) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt " + type.getSimpleName() + " attributes in stored graph '"
                    + storeName + "': " + json, e);
        }
    }
}
