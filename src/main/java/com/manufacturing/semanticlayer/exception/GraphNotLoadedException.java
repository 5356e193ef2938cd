package com.manufacturing.semanticlayer.exception;

/**
 * A query arrived before any graph was built or restored.
 */
public class GraphNotLoadedException extends SemanticLayerException {

    public GraphNotLoadedException() {
        super("No semantic graph loaded yet; rebuild from the catalog or restore from the store");
    }
}
