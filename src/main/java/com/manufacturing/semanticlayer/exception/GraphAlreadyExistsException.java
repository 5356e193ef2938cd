package com.manufacturing.semanticlayer.exception;

import lombok.Getter;

@Getter
public class GraphAlreadyExistsException extends SemanticLayerException {

    private final String storeName;

    public GraphAlreadyExistsException(String storeName) {
        super("Stored graph '" + storeName + "' already exists; persist with overwrite=true to replace it");
        this.storeName = storeName;
    }
}
