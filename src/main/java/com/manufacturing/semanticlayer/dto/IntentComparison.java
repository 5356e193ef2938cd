package com.manufacturing.semanticlayer.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Outcome of resolving one field under one intent: either a resolution or the
 * error that prevented it.
 */
@Value
@Builder
@Jacksonized
public class IntentComparison {
    String intent;
    ConceptResolution resolution;
    String error;
    String errorType;

    @JsonIgnore
    public boolean isResolved() {
        return resolution != null;
    }
}
