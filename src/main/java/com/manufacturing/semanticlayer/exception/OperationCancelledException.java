package com.manufacturing.semanticlayer.exception;

public class OperationCancelledException extends SemanticLayerException {

    public OperationCancelledException(String message) {
        super(message);
    }
}
