package com.manufacturing.semanticlayer.repository;

import com.manufacturing.semanticlayer.entity.CatalogConceptField;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CatalogConceptFieldRepository extends JpaRepository<CatalogConceptField, CatalogConceptField.Key> {

    /**
     * Field mappings ordered by (concept, table, field)
     */
    List<CatalogConceptField> findAllByOrderByConceptIdAscTableNameAscFieldNameAsc();
}
