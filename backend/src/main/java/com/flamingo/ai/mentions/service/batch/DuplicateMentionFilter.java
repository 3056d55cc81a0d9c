package com.flamingo.ai.mentions.service.batch;

import com.flamingo.ai.mentions.domain.model.Mention;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Drops mentions whose restaurant name is nothing but the dish: the restaurant token set equals the
 * dish and category token set. Such a mention survives only when its post also names a longer
 * restaurant containing all of its tokens. Mentions without a restaurant name are dropped too.
 */
final class DuplicateMentionFilter {

  private DuplicateMentionFilter() {}

  /**
   * Filters {@code mentions}.
   *
   * @param mentions mentions after name normalization
   * @param postIdOf owning post of a source id, null when unknown
   * @return the kept mentions in their original order
   */
  static List<Mention> filter(List<Mention> mentions, Function<String, String> postIdOf) {
    Map<String, Map<String, List<String>>> namesByPost = new HashMap<>();
    for (Mention mention : mentions) {
      String postId = postIdOf.apply(mention.getSourceId());
      List<String> tokens = NameTokens.of(mention.getRestaurantName());
      if (postId != null && !tokens.isEmpty()) {
        namesByPost
            .computeIfAbsent(postId, k -> new LinkedHashMap<>())
            .putIfAbsent(NameTokens.key(tokens), tokens);
      }
    }

    List<Mention> kept = new ArrayList<>(mentions.size());
    for (Mention mention : mentions) {
      if (keep(mention, namesByPost.get(postIdOf.apply(mention.getSourceId())))) {
        kept.add(mention);
      }
    }
    return kept;
  }

  private static boolean keep(Mention mention, Map<String, List<String>> postNames) {
    List<String> restaurantTokens = NameTokens.of(mention.getRestaurantName());
    if (restaurantTokens.isEmpty()) {
      return false;
    }

    Set<String> foodTokens = new HashSet<>(NameTokens.of(mention.getDishName()));
    if (mention.getDishCategories() != null) {
      for (String category : mention.getDishCategories()) {
        foodTokens.addAll(NameTokens.of(category));
      }
    }
    if (foodTokens.isEmpty()) {
      return true;
    }

    Set<String> restaurantSet = new HashSet<>(restaurantTokens);
    if (!restaurantSet.equals(foodTokens)) {
      return true;
    }

    if (postNames == null) {
      return false;
    }
    for (List<String> name : postNames.values()) {
      if (name.size() > restaurantTokens.size()
          && NameTokens.isSubset(restaurantTokens, new HashSet<>(name))) {
        return true;
      }
    }
    return false;
  }
}
