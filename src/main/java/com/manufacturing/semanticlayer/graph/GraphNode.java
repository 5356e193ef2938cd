package com.manufacturing.semanticlayer.graph;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A node of the schema or semantic graph. The kind decides which of the
 * optional fields are populated; use the static factories rather than the
 * builder so that the id always matches the kind's namespace.
 */
@Value
@Builder
@Jacksonized
public class GraphNode {

    @NonNull
    String id;

    @NonNull
    NodeKind kind;

    @NonNull
    String name;

    String description;

    // TABLE: fact / dimension / reference ...
    String tableType;

    // FIELD
    String tableName;
    String columnName;

    // INTENT, PERSPECTIVE, CONCEPT: primary key in the catalog
    Long catalogId;

    public static GraphNode table(String tableName, String tableType, String description) {
        return GraphNode.builder()
                .id(NodeKind.TABLE.idFor(tableName))
                .kind(NodeKind.TABLE)
                .name(tableName)
                .tableType(tableType)
                .description(description)
                .build();
    }

    public static GraphNode intent(Long intentId, String name, String description) {
        return named(NodeKind.INTENT, intentId, name, description);
    }

    public static GraphNode perspective(Long perspectiveId, String name, String description) {
        return named(NodeKind.PERSPECTIVE, perspectiveId, name, description);
    }

    public static GraphNode concept(Long conceptId, String name, String description) {
        return named(NodeKind.CONCEPT, conceptId, name, description);
    }

    public static GraphNode field(String tableName, String columnName) {
        return GraphNode.builder()
                .id(NodeKind.fieldId(tableName, columnName))
                .kind(NodeKind.FIELD)
                .name(tableName + "." + columnName)
                .tableName(tableName)
                .columnName(columnName)
                .build();
    }

    private static GraphNode named(NodeKind kind, Long catalogId, String name, String description) {
        return GraphNode.builder()
                .id(kind.idFor(name))
                .kind(kind)
                .name(name)
                .catalogId(catalogId)
                .description(description)
                .build();
    }
}
