package com.manufacturing.semanticlayer.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * One hop of a join path. {@code from}/{@code to} follow the walk; {@code edgeFrom}
 * and {@code edgeTo} keep the catalog direction of the relationship, so
 * {@code reversed} tells which side owns the join column.
 */
@Value
@Builder
@Jacksonized
public class JoinStep {
    String from;
    String to;
    String edgeFrom;
    String edgeTo;
    boolean reversed;
    String relationshipKind;
    String joinColumn;
    double weight;
    Map<String, String> metadata;
}
