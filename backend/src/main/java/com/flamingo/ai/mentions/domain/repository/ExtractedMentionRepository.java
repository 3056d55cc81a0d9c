package com.flamingo.ai.mentions.domain.repository;

import com.flamingo.ai.mentions.domain.entity.ExtractedMentionRecord;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for stored mentions. */
@Repository
public interface ExtractedMentionRepository extends JpaRepository<ExtractedMentionRecord, UUID> {

  /** True when any stored mention already names this restaurant. */
  boolean existsByRestaurantKey(String restaurantKey);

  /** True when this restaurant-dish pair was stored before. */
  boolean existsByRestaurantKeyAndDishKey(String restaurantKey, String dishKey);

  /** Finds all mentions for a source scope. */
  List<ExtractedMentionRecord> findBySourceScope(String sourceScope);
}
