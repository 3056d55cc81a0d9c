package com.flamingo.ai.mentions.service.batch;

import com.flamingo.ai.mentions.domain.model.Mention;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;

/**
 * Repairs restaurant names that absorbed a dish name ("Franklin Brisket" for Franklin serving
 * brisket), per post.
 *
 * <p>For each post a name table is built from its mentions: token key to occurrence count, summed
 * upvotes and the first surface form seen. A restaurant name sharing tokens with the mention's own
 * dish is stripped of those tokens; if a table entry fits inside the remainder, the best such entry
 * replaces the name. Otherwise the same is tried with every dish named anywhere in the post. Best
 * means most occurrences, then most upvotes, then most tokens.
 */
@Slf4j
final class RestaurantNameNormalizer {

  private RestaurantNameNormalizer() {}

  /**
   * Normalizes restaurant names in place.
   *
   * @param mentions mentions of one batch
   * @param postIdOf owning post of a source id, null when unknown
   * @return number of renamed mentions
   */
  static int normalize(List<Mention> mentions, Function<String, String> postIdOf) {
    Map<String, List<Mention>> byPost = new LinkedHashMap<>();
    for (Mention mention : mentions) {
      String postId = postIdOf.apply(mention.getSourceId());
      if (postId != null) {
        byPost.computeIfAbsent(postId, k -> new ArrayList<>()).add(mention);
      }
    }

    int renamed = 0;
    for (Map.Entry<String, List<Mention>> entry : byPost.entrySet()) {
      renamed += normalizePost(entry.getKey(), entry.getValue());
    }
    return renamed;
  }

  private static int normalizePost(String postId, List<Mention> postMentions) {
    Map<String, NameStats> nameTable = new LinkedHashMap<>();
    for (Mention mention : postMentions) {
      List<String> tokens = NameTokens.of(mention.getRestaurantName());
      if (tokens.isEmpty()) {
        continue;
      }
      int upvotes = mention.getSourceUpvotes() != null ? mention.getSourceUpvotes() : 0;
      String surface = mention.getRestaurantName().trim();
      nameTable
          .computeIfAbsent(NameTokens.key(tokens), k -> new NameStats(tokens, surface))
          .add(upvotes);
    }

    List<List<String>> dishSets = new ArrayList<>();
    Set<String> dishKeys = new HashSet<>();
    for (Mention mention : postMentions) {
      List<String> dishTokens = NameTokens.of(mention.getDishName());
      if (!dishTokens.isEmpty() && dishKeys.add(NameTokens.key(dishTokens))) {
        dishSets.add(dishTokens);
      }
    }

    int renamed = 0;
    for (Mention mention : postMentions) {
      List<String> restaurantTokens = NameTokens.of(mention.getRestaurantName());
      if (restaurantTokens.isEmpty()) {
        continue;
      }
      String currentKey = NameTokens.key(restaurantTokens);
      Set<String> restaurantSet = new HashSet<>(restaurantTokens);

      NameStats best = null;
      Set<String> ownDish = new HashSet<>(NameTokens.of(mention.getDishName()));
      if (ownDish.stream().anyMatch(restaurantSet::contains)) {
        best = bestWithin(remainder(restaurantTokens, ownDish), nameTable, null);
      }

      if (best == null || best.key().equals(currentKey)) {
        best = null;
        for (List<String> dishTokens : dishSets) {
          Set<String> dishSet = new HashSet<>(dishTokens);
          if (NameTokens.isSubset(dishSet, restaurantSet)) {
            best = bestWithin(remainder(restaurantTokens, dishSet), nameTable, best);
          }
        }
      }

      if (best != null && !best.key().equals(currentKey)) {
        log.debug(
            "Post {}: renaming restaurant '{}' to '{}'",
            postId,
            mention.getRestaurantName(),
            best.surface);
        mention.setRestaurantName(best.surface);
        renamed++;
      }
    }
    return renamed;
  }

  private static List<String> remainder(List<String> tokens, Set<String> removed) {
    return tokens.stream().filter(token -> !removed.contains(token)).toList();
  }

  /** Best table entry whose tokens all occur in {@code remainder}, starting from {@code best}. */
  private static NameStats bestWithin(
      List<String> remainder, Map<String, NameStats> nameTable, NameStats best) {
    if (remainder.isEmpty()) {
      return best;
    }
    Set<String> remainderSet = new HashSet<>(remainder);
    for (NameStats candidate : nameTable.values()) {
      if (NameTokens.isSubset(candidate.tokens, remainderSet) && candidate.beats(best)) {
        best = candidate;
      }
    }
    return best;
  }

  private static final class NameStats {
    private final List<String> tokens;
    private final String surface;
    private int count;
    private int upvotes;

    private NameStats(List<String> tokens, String surface) {
      this.tokens = tokens;
      this.surface = surface;
    }

    private void add(int mentionUpvotes) {
      count++;
      upvotes += mentionUpvotes;
    }

    private String key() {
      return NameTokens.key(tokens);
    }

    private boolean beats(NameStats other) {
      if (other == null) {
        return true;
      }
      if (count != other.count) {
        return count > other.count;
      }
      if (upvotes != other.upvotes) {
        return upvotes > other.upvotes;
      }
      return tokens.size() > other.tokens.size();
    }
  }
}
