package com.manufacturing.semanticlayer.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

/**
 * An abstract business metric, e.g. MATERIAL_NON_CONFORMANCE ({@code schema_concepts}).
 */
@Entity
@Immutable
@Table(name = "schema_concepts")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogConcept {

    @Id
    @Column(name = "concept_id")
    private Long conceptId;

    @Column(name = "concept_name", nullable = false)
    private String conceptName;

    @Column(columnDefinition = "TEXT")
    private String description;
}
