package com.manufacturing.semanticlayer.store;

import lombok.Value;

/**
 * A vertex as written to the graph store. {@code key} is store-safe,
 * {@code label} is the original node id, {@code attributes} the JSON form of
 * the node.
 */
@Value
public class StoredNode {
    String key;
    String label;
    String kind;
    String attributes;
}
