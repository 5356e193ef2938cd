package com.manufacturing.semanticlayer.store;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Marker of a stored graph; also the handle returned by a successful persist.
 */
@Value
@Builder(toBuilder = true)
public class StoredGraphInfo {
    String storeName;
    // name of the in-memory graph that was persisted
    String graphName;
    boolean directed;
    long nodeCount;
    long edgeCount;
    Instant persistedAt;
}
