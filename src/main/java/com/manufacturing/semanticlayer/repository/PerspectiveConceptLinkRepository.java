package com.manufacturing.semanticlayer.repository;

import com.manufacturing.semanticlayer.entity.PerspectiveConceptLink;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PerspectiveConceptLinkRepository extends JpaRepository<PerspectiveConceptLink, PerspectiveConceptLink.Key> {

    List<PerspectiveConceptLink> findAllByOrderByPerspectiveIdAscConceptIdAsc();
}
