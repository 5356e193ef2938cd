package com.manufacturing.semanticlayer.repository;

import com.manufacturing.semanticlayer.entity.CatalogIntent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CatalogIntentRepository extends JpaRepository<CatalogIntent, Long> {

    List<CatalogIntent> findAllByOrderByIntentIdAsc();
}
