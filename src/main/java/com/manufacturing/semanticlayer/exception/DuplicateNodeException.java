package com.manufacturing.semanticlayer.exception;

import lombok.Getter;

@Getter
public class DuplicateNodeException extends SemanticLayerException {

    private final String nodeId;

    public DuplicateNodeException(String nodeId) {
        super("Node already present: '" + nodeId + "'");
        this.nodeId = nodeId;
    }
}
