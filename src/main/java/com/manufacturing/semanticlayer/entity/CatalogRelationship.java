package com.manufacturing.semanticlayer.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

/**
 * A directed join relationship between two tables ({@code schema_edges}).
 * The enrichment columns feed the SQL generator's prompt context.
 */
@Entity
@Immutable
@Table(name = "schema_edges")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogRelationship {

    @Id
    @Column(name = "edge_id")
    private Long edgeId;

    @Column(name = "from_table", nullable = false)
    private String fromTable;

    @Column(name = "to_table", nullable = false)
    private String toTable;

    @Column(name = "relationship_type")
    private String relationshipType;

    @Column(name = "join_column")
    private String joinColumn;

    // Path cost; NULL in the catalog means the column default of 1
    private Double weight;

    @Column(name = "join_column_description", columnDefinition = "TEXT")
    private String joinColumnDescription;

    @Column(name = "natural_language_alias")
    private String naturalLanguageAlias;

    @Column(name = "few_shot_example", columnDefinition = "TEXT")
    private String fewShotExample;

    @Column(columnDefinition = "TEXT")
    private String context;
}
