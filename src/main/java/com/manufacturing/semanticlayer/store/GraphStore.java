package com.manufacturing.semanticlayer.store;

import java.util.List;
import java.util.Optional;

/**
 * External shared graph store. Implementations raise
 * {@link com.manufacturing.semanticlayer.exception.StoreUnavailableException}
 * when the store cannot be reached; any other runtime exception means the
 * statement itself failed.
 *
 * <p>Graphs are written under a staging name and made visible with
 * {@link #promote(String, String)}, which must replace the target atomically.
 * Callers serialize writes to the same store name.
 */
public interface GraphStore {

    Optional<StoredGraphInfo> find(String storeName);

    /**
     * Creates the marker of an empty graph.
     */
    void create(StoredGraphInfo info);

    void writeNodes(String storeName, List<StoredNode> batch);

    /**
     * Endpoints are referenced by key and must already be written.
     */
    void writeEdges(String storeName, List<StoredEdge> batch);

    /**
     * Deletes {@code targetName} if present and renames {@code stagingName} to
     * it, in one transaction.
     */
    StoredGraphInfo promote(String stagingName, String targetName);

    /**
     * Removes a graph with all its vertices and edges. No-op when absent.
     */
    void drop(String storeName);

    Optional<StoredGraph> read(String storeName);
}
