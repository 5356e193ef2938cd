package com.manufacturing.semanticlayer.repository;

import com.manufacturing.semanticlayer.entity.IntentConceptLink;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface IntentConceptLinkRepository extends JpaRepository<IntentConceptLink, IntentConceptLink.Key> {

    List<IntentConceptLink> findAllByOrderByIntentIdAscConceptIdAsc();
}
