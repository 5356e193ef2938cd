package com.manufacturing.semanticlayer.repository;

import com.manufacturing.semanticlayer.entity.CatalogConcept;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CatalogConceptRepository extends JpaRepository<CatalogConcept, Long> {

    List<CatalogConcept> findAllByOrderByConceptIdAsc();
}
