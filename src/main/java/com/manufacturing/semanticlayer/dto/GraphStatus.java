package com.manufacturing.semanticlayer.dto;

import com.manufacturing.semanticlayer.graph.CatalogGraphs;
import com.manufacturing.semanticlayer.graph.GraphSummary;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Summary of the graphs currently served.
 */
@Value
@Builder
public class GraphStatus {
    GraphSummary schema;
    GraphSummary semantic;
    Instant builtAt;
    CatalogGraphs.Origin origin;

    public static GraphStatus of(CatalogGraphs graphs) {
        return GraphStatus.builder()
                .schema(graphs.getSchemaGraph().summary())
                .semantic(graphs.getSemanticGraph().summary())
                .builtAt(graphs.getBuiltAt())
                .origin(graphs.getOrigin())
                .build();
    }
}
