package com.manufacturing.semanticlayer.graph;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class GraphSummary {
    String name;
    boolean directed;
    int nodeCount;
    int edgeCount;
    Map<NodeKind, Long> nodesByKind;
    Map<EdgeType, Long> edgesByType;
    /** Weakly connected for directed graphs. */
    boolean connected;
    double density;
}
