package com.manufacturing.semanticlayer.exception;

import lombok.Getter;

@Getter
public class DuplicateEdgeException extends SemanticLayerException {

    private final String from;
    private final String to;

    public DuplicateEdgeException(String from, String to) {
        super("Edge already present: '" + from + "' -> '" + to + "'");
        this.from = from;
        this.to = to;
    }
}
