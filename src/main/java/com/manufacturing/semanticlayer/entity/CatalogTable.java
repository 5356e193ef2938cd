package com.manufacturing.semanticlayer.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

/**
 * A table known to the schema graph (one row of {@code schema_nodes}).
 */
@Entity
@Immutable
@Table(name = "schema_nodes")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogTable {

    @Id
    @Column(name = "table_name")
    private String tableName;

    @Column(name = "table_type")
    private String tableType; // fact, dimension, reference ...

    @Column(columnDefinition = "TEXT")
    private String description;
}
