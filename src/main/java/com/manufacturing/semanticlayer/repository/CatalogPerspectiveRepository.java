package com.manufacturing.semanticlayer.repository;

import com.manufacturing.semanticlayer.entity.CatalogPerspective;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CatalogPerspectiveRepository extends JpaRepository<CatalogPerspective, Long> {

    List<CatalogPerspective> findAllByOrderByPerspectiveIdAsc();
}
