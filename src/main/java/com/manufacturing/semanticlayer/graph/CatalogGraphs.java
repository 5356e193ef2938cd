package com.manufacturing.semanticlayer.graph;

import lombok.Value;

import java.time.Instant;

/**
 * The schema graph and the semantic graph built from one catalog snapshot
 * (or restored together from the graph store). Both graphs are sealed.
 */
@Value
public class CatalogGraphs {
    GraphModel schemaGraph;
    GraphModel semanticGraph;
    Instant builtAt;
    Origin origin;

    public enum Origin {
        CATALOG,
        STORE
    }
}
