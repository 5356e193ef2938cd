package com.manufacturing.semanticlayer.exception;

import lombok.Getter;

@Getter
public class GraphNotFoundException extends SemanticLayerException {

    private final String storeName;

    public GraphNotFoundException(String storeName) {
        super("No stored graph named '" + storeName + "'");
        this.storeName = storeName;
    }
}
