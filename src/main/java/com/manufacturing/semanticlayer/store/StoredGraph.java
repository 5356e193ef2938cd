package com.manufacturing.semanticlayer.store;

import lombok.Value;

import java.util.List;

@Value
public class StoredGraph {
    StoredGraphInfo info;
    List<StoredNode> nodes;
    List<StoredEdge> edges;
}
