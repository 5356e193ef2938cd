package com.manufacturing.semanticlayer.graph;

/**
 * Closed set of node kinds. Schema graphs hold only {@link #TABLE} nodes,
 * semantic graphs hold the other four.
 */
public enum NodeKind {
    TABLE(""),
    INTENT("intent:"),
    PERSPECTIVE("perspective:"),
    CONCEPT("concept:"),
    FIELD("field:");

    private final String idPrefix;

    NodeKind(String idPrefix) {
        this.idPrefix = idPrefix;
    }

    /**
     * Graph id for a node of this kind. Names are unique per kind, so the
     * prefix keeps an intent and a concept with the same name apart.
     */
    public String idFor(String name) {
        return idPrefix + name;
    }

    public static String fieldId(String tableName, String columnName) {
        return FIELD.idFor(tableName + "." + columnName);
    }
}
