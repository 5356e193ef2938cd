package com.manufacturing.semanticlayer.repository;

import com.manufacturing.semanticlayer.entity.IntentPerspectiveLink;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface IntentPerspectiveLinkRepository extends JpaRepository<IntentPerspectiveLink, IntentPerspectiveLink.Key> {

    List<IntentPerspectiveLink> findAllByOrderByIntentIdAscPerspectiveIdAsc();
}
