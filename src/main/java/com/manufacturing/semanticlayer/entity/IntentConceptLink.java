package com.manufacturing.semanticlayer.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.io.Serializable;

/**
 * Direct intent influence on a concept ({@code schema_intent_concepts}):
 * +1 elevates, -1 suppresses, 0 is neutral.
 */
@Entity
@Immutable
@Table(name = "schema_intent_concepts")
@IdClass(IntentConceptLink.Key.class)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IntentConceptLink {

    @Id
    @Column(name = "intent_id")
    private Long intentId;

    @Id
    @Column(name = "concept_id")
    private Long conceptId;

    @Column(name = "intent_factor_weight")
    private Integer intentFactorWeight;

    @Column(columnDefinition = "TEXT")
    private String explanation;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Key implements Serializable {
        private Long intentId;
        private Long conceptId;
    }
}
