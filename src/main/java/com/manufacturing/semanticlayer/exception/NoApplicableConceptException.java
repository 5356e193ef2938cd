package com.manufacturing.semanticlayer.exception;

import lombok.Getter;

@Getter
public class NoApplicableConceptException extends SemanticLayerException {

    private final String intentName;
    private final String fieldName;

    public NoApplicableConceptException(String intentName, String fieldName) {
        super("No concept CAN_MEAN field '" + fieldName + "' (intent '" + intentName + "')");
        this.intentName = intentName;
        this.fieldName = fieldName;
    }
}
