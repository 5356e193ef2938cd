package com.manufacturing.semanticlayer.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.io.Serializable;

/**
 * A concrete {@code table.field} that can mean a concept
 * ({@code schema_concept_fields}). Becomes a CAN_MEAN edge.
 */
@Entity
@Immutable
@Table(name = "schema_concept_fields")
@IdClass(CatalogConceptField.Key.class)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogConceptField {

    @Id
    @Column(name = "concept_id")
    private Long conceptId;

    @Id
    @Column(name = "table_name")
    private String tableName;

    @Id
    @Column(name = "field_name")
    private String fieldName;

    // Canonical field for the concept within its table
    @Column(name = "is_primary")
    private Boolean primary;

    @Column(name = "table_alias")
    private String tableAlias;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Key implements Serializable {
        private Long conceptId;
        private String tableName;
        private String fieldName;
    }
}
