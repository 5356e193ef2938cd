package com.manufacturing.semanticlayer.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.io.Serializable;

/**
 * Perspective USES_DEFINITION concept ({@code schema_perspective_concepts}).
 * When {@code elevationWeight} is set the perspective also elevates (weight > 0)
 * or suppresses (weight = 0) the concept in field collisions.
 */
@Entity
@Immutable
@Table(name = "schema_perspective_concepts")
@IdClass(PerspectiveConceptLink.Key.class)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerspectiveConceptLink {

    @Id
    @Column(name = "perspective_id")
    private Long perspectiveId;

    @Id
    @Column(name = "concept_id")
    private Long conceptId;

    @Column(name = "elevation_weight")
    private Double elevationWeight;

    @Column(name = "collision_resolution", columnDefinition = "TEXT")
    private String collisionResolution;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Key implements Serializable {
        private Long perspectiveId;
        private Long conceptId;
    }
}
