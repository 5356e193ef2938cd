package com.manufacturing.semanticlayer.exception;

import lombok.Getter;

@Getter
public class StoreUnavailableException extends SemanticLayerException {

    private final String storeName;

    public StoreUnavailableException(String storeName, String operation, Throwable cause) {
        super("Graph store unavailable during " + operation + " of '" + storeName + "': " + cause.getMessage(), cause);
        this.storeName = storeName;
    }
}
