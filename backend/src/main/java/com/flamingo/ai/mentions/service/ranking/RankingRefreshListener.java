package com.flamingo.ai.mentions.service.ranking;

import com.flamingo.ai.mentions.domain.entity.ExtractedMentionRecord;
import com.flamingo.ai.mentions.domain.repository.ExtractedMentionRepository;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Rebuilds the restaurant ranking of a scope from stored mentions. A restaurant scores one point
 * per mention plus the upvotes of the sources that mentioned it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RankingRefreshListener {

  private static final int LOGGED_TOP = 5;

  private final ExtractedMentionRepository mentionRepository;

  /** One ranked restaurant. */
  public record RankedRestaurant(String restaurantKey, String name, long mentions, long score) {}

  @EventListener
  @Transactional(readOnly = true)
  public void onRefreshRequested(RankingRefreshRequestedEvent event) {
    List<RankedRestaurant> ranking = rank(mentionRepository.findBySourceScope(event.sourceScope()));
    log.info(
        "Ranking refreshed for {}: {} restaurants, top {}",
        event.sourceScope(),
        ranking.size(),
        ranking.stream().limit(LOGGED_TOP).map(RankedRestaurant::name).toList());
  }

  static List<RankedRestaurant> rank(List<ExtractedMentionRecord> records) {
    Map<String, long[]> totals = new HashMap<>();
    Map<String, String> names = new HashMap<>();
    for (ExtractedMentionRecord record : records) {
      long[] total = totals.computeIfAbsent(record.getRestaurantKey(), k -> new long[2]);
      total[0]++;
      total[1] += 1 + Math.max(0, record.getSourceUpvotes());
      names.putIfAbsent(record.getRestaurantKey(), record.getRestaurantName());
    }
    return totals.entrySet().stream()
        .map(
            e ->
                new RankedRestaurant(
                    e.getKey(), names.get(e.getKey()), e.getValue()[0], e.getValue()[1]))
        .sorted(
            Comparator.comparingLong(RankedRestaurant::score)
                .reversed()
                .thenComparing(RankedRestaurant::restaurantKey))
        .toList();
  }
}
