package com.manufacturing.semanticlayer.repository;

import com.manufacturing.semanticlayer.entity.CatalogTable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CatalogTableRepository extends JpaRepository<CatalogTable, String> {

    List<CatalogTable> findAllByOrderByTableNameAsc();
}
