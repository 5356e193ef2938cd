package com.manufacturing.semanticlayer.exception;

import lombok.Getter;

@Getter
public class NoPathException extends SemanticLayerException {

    private final String sourceTable;
    private final String targetTable;

    public NoPathException(String sourceTable, String targetTable) {
        super("No join path between '" + sourceTable + "' and '" + targetTable + "'");
        this.sourceTable = sourceTable;
        this.targetTable = targetTable;
    }
}
