package com.manufacturing.semanticlayer.exception;

/**
 * Base type for every failure raised by the graph model, the catalog loader,
 * the resolvers and the graph store adapter.
 */
public abstract class SemanticLayerException extends RuntimeException {

    protected SemanticLayerException(String message) {
        super(message);
    }

    protected SemanticLayerException(String message, Throwable cause) {
        super(message, cause);
    }
}
