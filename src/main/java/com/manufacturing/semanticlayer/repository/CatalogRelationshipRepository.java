package com.manufacturing.semanticlayer.repository;

import com.manufacturing.semanticlayer.entity.CatalogRelationship;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CatalogRelationshipRepository extends JpaRepository<CatalogRelationship, Long> {

    /**
     * Relationships in primary-key order, so graph construction is reproducible
     */
    List<CatalogRelationship> findAllByOrderByEdgeIdAsc();
}
