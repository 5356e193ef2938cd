package com.manufacturing.semanticlayer.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * The authoritative (table, column) for an ambiguous field under an intent,
 * with the scores that decided it.
 */
@Value
@Builder
@Jacksonized
public class ConceptResolution {
    String intent;
    String fieldName;
    String concept;
    String table;
    String column;
    String tableAlias;
    double score;
    String decidingPerspective;
    /** Rendered as {@code from -[TYPE]-> to}, or null when no edge contributed. */
    String decidingEdge;
    String rationale;
    List<ConceptScore> candidates;
}
