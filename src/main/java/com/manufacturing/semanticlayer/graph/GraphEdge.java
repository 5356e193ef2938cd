package com.manufacturing.semanticlayer.graph;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * A directed, attributed edge. Typed attributes cover every edge kind; the
 * {@link #metadata} map holds only the free-form enrichment of schema
 * relationships (aliases, examples, context).
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class GraphEdge {

    public static final String JOIN_COLUMN_DESCRIPTION = "join_column_description";
    public static final String NATURAL_LANGUAGE_ALIAS = "natural_language_alias";
    public static final String FEW_SHOT_EXAMPLE = "few_shot_example";
    public static final String CONTEXT = "context";

    @NonNull
    String from;

    @NonNull
    String to;

    @NonNull
    EdgeType type;

    /**
     * Path cost for RELATES_TO, engagement for OPERATES_WITHIN, the direct
     * intent weight (-1, 0, +1) for ELEVATES / SUPPRESSES / NEUTRAL.
     */
    Double weight;

    // RELATES_TO
    String relationshipKind;
    String joinColumn;

    // CAN_MEAN
    Boolean primary;
    String tableAlias;

    // USES_DEFINITION
    Elevation elevation;
    Double elevationWeight;

    String rationale;

    @Singular("metadataEntry")
    Map<String, String> metadata;

    @JsonIgnore
    public boolean isPrimaryField() {
        return Boolean.TRUE.equals(primary);
    }

    public double weightOr(double fallback) {
        return weight != null ? weight : fallback;
    }

    /**
     * The other endpoint when this edge is walked from {@code nodeId}.
     */
    public String opposite(String nodeId) {
        return from.equals(nodeId) ? to : from;
    }
}
