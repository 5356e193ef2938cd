package com.manufacturing.semanticlayer.store;

import com.manufacturing.semanticlayer.exception.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.exceptions.ServiceUnavailableException;
import org.neo4j.driver.exceptions.SessionExpiredException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.data.neo4j.core.Neo4jClient;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Graph store on Neo4j.
 *
 * <pre>
 * (:StoredGraph {name, graphName, directed, nodeCount, edgeCount, persistedAt})
 * (:GraphVertex {graph, key, label, kind, attributes})
 * (:GraphVertex)-[:GRAPH_EDGE {graph, type, attributes}]->(:GraphVertex)
 * </pre>
 *
 * Every vertex and relationship carries the name of the graph it belongs to,
 * so several stored graphs share one database.
 */
@Component
@Slf4j
public class Neo4jGraphStore implements GraphStore {

    private static final String FIND_GRAPH = """
            MATCH (g:StoredGraph {name: $name})
            RETURN g.name AS name, g.graphName AS graphName, g.directed AS directed,
                   g.nodeCount AS nodeCount, g.edgeCount AS edgeCount, g.persistedAt AS persistedAt
            """;

    private static final String CREATE_GRAPH = """
            CREATE (g:StoredGraph {name: $name, graphName: $graphName, directed: $directed,
                                   nodeCount: $nodeCount, edgeCount: $edgeCount, persistedAt: $persistedAt})
            """;

    private static final String WRITE_NODES = """
            UNWIND $rows AS row
            CREATE (v:GraphVertex {graph: $graph, key: row.key, label: row.label,
                                   kind: row.kind, attributes: row.attributes})
            RETURN count(v) AS created
            """;

    private static final String WRITE_EDGES = """
            UNWIND $rows AS row
            MATCH (a:GraphVertex {graph: $graph, key: row.fromKey})
            MATCH (b:GraphVertex {graph: $graph, key: row.toKey})
            CREATE (a)-[r:GRAPH_EDGE {graph: $graph, type: row.type, attributes: row.attributes}]->(b)
            RETURN count(r) AS created
            """;

    private static final String DELETE_VERTICES = "MATCH (v:GraphVertex {graph: $name}) DETACH DELETE v";

    private static final String DELETE_MARKER = "MATCH (g:StoredGraph {name: $name}) DELETE g";

    private static final String RENAME_VERTICES = "MATCH (v:GraphVertex {graph: $from}) SET v.graph = $to";

    private static final String RENAME_EDGES = "MATCH ()-[r:GRAPH_EDGE {graph: $from}]->() SET r.graph = $to";

    private static final String RENAME_MARKER = """
            MATCH (g:StoredGraph {name: $from})
            SET g.name = $to, g.persistedAt = $persistedAt
            """;

    private static final String READ_NODES = """
            MATCH (v:GraphVertex {graph: $name})
            RETURN v.key AS key, v.label AS label, v.kind AS kind, v.attributes AS attributes
            ORDER BY v.key
            """;

    private static final String READ_EDGES = """
            MATCH (a:GraphVertex {graph: $name})-[r:GRAPH_EDGE {graph: $name}]->(b:GraphVertex {graph: $name})
            RETURN a.key AS fromKey, b.key AS toKey, r.type AS type, r.attributes AS attributes
            ORDER BY a.key, b.key
            """;

    private final Neo4jClient neo4jClient;
    private final TransactionTemplate transactionTemplate;

    public Neo4jGraphStore(Neo4jClient neo4jClient,
                           @Qualifier("neo4jTransactionTemplate") TransactionTemplate transactionTemplate) {
        this.neo4jClient = neo4jClient;
        this.transactionTemplate = transactionTemplate;
    }

    @Override
    public Optional<StoredGraphInfo> find(String storeName) {
        return call(storeName, "find", () -> neo4jClient.query(FIND_GRAPH)
                .bind(storeName).to("name")
                .fetch()
                .one()
                .map(Neo4jGraphStore::toInfo));
    }

    @Override
    public void create(StoredGraphInfo info) {
        call(info.getStoreName(), "create", () -> neo4jClient.query(CREATE_GRAPH)
                .bindAll(Map.of(
                        "name", info.getStoreName(),
                        "graphName", info.getGraphName(),
                        "directed", info.isDirected(),
                        "nodeCount", info.getNodeCount(),
                        "edgeCount", info.getEdgeCount(),
                        "persistedAt", info.getPersistedAt().atZone(ZoneOffset.UTC)))
                .run());
    }

    @Override
    public void writeNodes(String storeName, List<StoredNode> batch) {
        List<Map<String, Object>> rows = batch.stream()
                .map(node -> Map.<String, Object>of(
                        "key", node.getKey(),
                        "label", node.getLabel(),
                        "kind", node.getKind(),
                        "attributes", node.getAttributes()))
                .collect(Collectors.toList());
        long created = writeBatch(storeName, "node write", WRITE_NODES, rows);
        checkCreated(storeName, "vertices", created, batch.size());
    }

    @Override
    public void writeEdges(String storeName, List<StoredEdge> batch) {
        List<Map<String, Object>> rows = batch.stream()
                .map(edge -> Map.<String, Object>of(
                        "fromKey", edge.getFromKey(),
                        "toKey", edge.getToKey(),
                        "type", edge.getType(),
                        "attributes", edge.getAttributes()))
                .collect(Collectors.toList());
        long created = writeBatch(storeName, "edge write", WRITE_EDGES, rows);
        // a missing endpoint makes MATCH drop the row silently
        checkCreated(storeName, "edges", created, batch.size());
    }

    @Override
    public StoredGraphInfo promote(String stagingName, String targetName) {
        return call(targetName, "promote", () -> transactionTemplate.execute(status -> {
            Map<String, Object> target = Map.of("name", targetName);
            neo4jClient.query(DELETE_VERTICES).bindAll(target).run();
            neo4jClient.query(DELETE_MARKER).bindAll(target).run();

            Map<String, Object> rename = Map.of("from", stagingName, "to", targetName);
            neo4jClient.query(RENAME_VERTICES).bindAll(rename).run();
            neo4jClient.query(RENAME_EDGES).bindAll(rename).run();
            neo4jClient.query(RENAME_MARKER)
                    .bindAll(Map.of("from", stagingName, "to", targetName,
                            "persistedAt", ZonedDateTime.now(ZoneOffset.UTC)))
                    .run();

            return neo4jClient.query(FIND_GRAPH)
                    .bind(targetName).to("name")
                    .fetch()
                    .one()
                    .map(Neo4jGraphStore::toInfo)
                    .orElseThrow(() -> new IllegalStateException(
                            "Staging graph '" + stagingName + "' vanished before promotion"));
        }));
    }

    @Override
    public void drop(String storeName) {
        call(storeName, "drop", () -> transactionTemplate.execute(status -> {
            Map<String, Object> params = Map.of("name", storeName);
            neo4jClient.query(DELETE_VERTICES).bindAll(params).run();
            return neo4jClient.query(DELETE_MARKER).bindAll(params).run();
        }));
    }

    @Override
    public Optional<StoredGraph> read(String storeName) {
        return call(storeName, "read", () -> transactionTemplate.execute(status -> {
            Optional<StoredGraphInfo> info = neo4jClient.query(FIND_GRAPH)
                    .bind(storeName).to("name")
                    .fetch()
                    .one()
                    .map(Neo4jGraphStore::toInfo);
            if (info.isEmpty()) {
                return Optional.<StoredGraph>empty();
            }

            List<StoredNode> nodes = neo4jClient.query(READ_NODES)
                    .bind(storeName).to("name")
                    .fetch()
                    .all()
                    .stream()
                    .map(row -> new StoredNode((String) row.get("key"), (String) row.get("label"),
                            (String) row.get("kind"), (String) row.get("attributes")))
                    .collect(Collectors.toList());
            List<StoredEdge> edges = neo4jClient.query(READ_EDGES)
                    .bind(storeName).to("name")
                    .fetch()
                    .all()
                    .stream()
                    .map(row -> new StoredEdge((String) row.get("fromKey"), (String) row.get("toKey"),
                            (String) row.get("type"), (String) row.get("attributes")))
                    .collect(Collectors.toList());
            log.debug("Read graph '{}' from Neo4j: {} vertices, {} edges", storeName, nodes.size(), edges.size());
            return Optional.of(new StoredGraph(info.get(), nodes, edges));
        }));
    }

    private long writeBatch(String storeName, String operation, String cypher, List<Map<String, Object>> rows) {
        return call(storeName, operation, () -> neo4jClient.query(cypher)
                .bindAll(Map.of("graph", storeName, "rows", rows))
                .fetchAs(Long.class)
                .one()
                .orElse(0L));
    }

    private static void checkCreated(String storeName, String what, long created, int expected) {
        if (created != expected) {
            throw new IllegalStateException("Graph '" + storeName + "': wrote " + created + " of "
                    + expected + " " + what + " in batch");
        }
    }

    /**
     * Runs a store call, translating connection-level failures into
     * {@link StoreUnavailableException}. Statement failures pass through.
     */
    private <T> T call(String storeName, String operation, Supplier<T> work) {
        try {
            return work.get();
        } catch (RuntimeException e) {
            if (isUnavailable(e)) {
                log.error("Neo4j unavailable during {} of '{}': {}", operation, storeName, e.getMessage());
                throw new StoreUnavailableException(storeName, operation, e);
            }
            throw e;
        }
    }

    private static boolean isUnavailable(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof ServiceUnavailableException
                    || t instanceof SessionExpiredException
                    || t instanceof DataAccessResourceFailureException
                    || t instanceof TransientDataAccessResourceException
                    || t instanceof CannotCreateTransactionException) {
                return true;
            }
        }
        return false;
    }

    private static StoredGraphInfo toInfo(Map<String, Object> row) {
        return StoredGraphInfo.builder()
                .storeName((String) row.get("name"))
                .graphName((String) row.get("graphName"))
                .directed(Boolean.TRUE.equals(row.get("directed")))
                .nodeCount(toLong(row.get("nodeCount")))
                .edgeCount(toLong(row.get("edgeCount")))
                .persistedAt(toInstant(row.get("persistedAt")))
                .build();
    }

    private static long toLong(Object value) {
        return value instanceof Number ? ((Number) value).longValue() : 0L;
    }

    private static Instant toInstant(Object value) {
        if (value instanceof TemporalAccessor) {
            return Instant.from((TemporalAccessor) value);
        }
        return null;
    }
}
