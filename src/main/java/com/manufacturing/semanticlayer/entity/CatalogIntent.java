package com.manufacturing.semanticlayer.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

/**
 * An analytical purpose such as quality-analysis ({@code schema_intents}).
 */
@Entity
@Immutable
@Table(name = "schema_intents")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogIntent {

    @Id
    @Column(name = "intent_id")
    private Long intentId;

    @Column(name = "intent_name", nullable = false)
    private String intentName;

    @Column(columnDefinition = "TEXT")
    private String description;
}
