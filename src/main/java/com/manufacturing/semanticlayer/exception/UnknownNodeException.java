package com.manufacturing.semanticlayer.exception;

import lombok.Getter;

@Getter
public class UnknownNodeException extends SemanticLayerException {

    private final String nodeId;

    public UnknownNodeException(String nodeId) {
        super("Unknown node: '" + nodeId + "'");
        this.nodeId = nodeId;
    }

    public UnknownNodeException(String nodeId, String context) {
        super("Unknown node: '" + nodeId + "' (" + context + ")");
        this.nodeId = nodeId;
    }
}
