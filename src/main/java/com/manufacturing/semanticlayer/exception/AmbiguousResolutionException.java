package com.manufacturing.semanticlayer.exception;

import lombok.Getter;

import java.util.List;

/**
 * Raised when a concept or table cannot be singled out. {@link #getCandidates()}
 * lists every tied candidate so a disambiguating catalog edge can be added.
 */
@Getter
public class AmbiguousResolutionException extends SemanticLayerException {

    private final String intentName;
    private final String fieldName;
    private final List<String> candidates;

    public AmbiguousResolutionException(String intentName, String fieldName, String reason, List<String> candidates) {
        super("Ambiguous resolution of field '" + fieldName + "' for intent '" + intentName + "': "
                + reason + " " + candidates);
        this.intentName = intentName;
        this.fieldName = fieldName;
        this.candidates = List.copyOf(candidates);
    }
}
