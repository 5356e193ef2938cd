package com.manufacturing.semanticlayer.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.io.Serializable;

/**
 * Intent OPERATES_WITHIN perspective ({@code schema_intent_perspectives}).
 * Ids are kept as plain columns so that dangling references reach the loader
 * and get reported instead of failing inside the ORM.
 */
@Entity
@Immutable
@Table(name = "schema_intent_perspectives")
@IdClass(IntentPerspectiveLink.Key.class)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IntentPerspectiveLink {

    @Id
    @Column(name = "intent_id")
    private Long intentId;

    @Id
    @Column(name = "perspective_id")
    private Long perspectiveId;

    @Column(name = "intent_factor_weight")
    private Double intentFactorWeight;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Key implements Serializable {
        private Long intentId;
        private Long perspectiveId;
    }
}
