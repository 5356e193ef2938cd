package com.manufacturing.semanticlayer.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Score breakdown of one candidate concept for a field under an intent.
 */
@Value
@Builder
@Jacksonized
public class ConceptScore {
    String concept;
    double score;
    double perspectiveElevation;
    double intentDirectWeight;
    // null when no engaged perspective uses the concept
    String decidingPerspective;
    // smallest table alias among the concept's CAN_MEAN edges for the field
    String tableAlias;
}
