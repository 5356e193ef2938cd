package com.manufacturing.semanticlayer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * JSON error body. {@code details} names the offending identifiers,
 * {@code candidates} the tied options of an ambiguous resolution and
 * {@code violations} the rejected catalog rows.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ErrorResponse {
    Instant timestamp;
    int status;
    String error;
    String message;
    String path;
    @Singular
    Map<String, Object> details;
    List<String> candidates;
    List<String> violations;
}
