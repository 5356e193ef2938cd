package com.manufacturing.semanticlayer.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

/**
 * A viewpoint an intent operates within, e.g. Quality or Finance ({@code schema_perspectives}).
 */
@Entity
@Immutable
@Table(name = "schema_perspectives")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogPerspective {

    @Id
    @Column(name = "perspective_id")
    private Long perspectiveId;

    @Column(name = "perspective_name", nullable = false)
    private String perspectiveName;

    @Column(columnDefinition = "TEXT")
    private String description;
}
