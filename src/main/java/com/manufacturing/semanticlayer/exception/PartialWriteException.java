package com.manufacturing.semanticlayer.exception;

import lombok.Getter;

/**
 * A batch failed mid-stream. The stored graph named {@link #getStoreName()} is
 * left as it was before the call; re-run with overwrite enabled to replace it.
 */
@Getter
public class PartialWriteException extends SemanticLayerException {

    private final String storeName;
    private final String phase;
    private final int batchIndex;

    public PartialWriteException(String storeName, String phase, int batchIndex, Throwable cause) {
        super("Write of graph '" + storeName + "' failed at " + phase + " batch " + batchIndex
                + ": " + cause.getMessage(), cause);
        this.storeName = storeName;
        this.phase = phase;
        this.batchIndex = batchIndex;
    }
}
