package com.flamingo.ai.mentions.service.freshness;

import com.flamingo.ai.mentions.client.forum.ForumContentClient;
import com.flamingo.ai.mentions.config.PipelineConfig;
import com.flamingo.ai.mentions.service.normalize.ForumFields;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Decides which posts are worth re-fetching.
 *
 * <p>A post never seen by any configured pipeline is fetched. A post processed within the lookback
 * window is skipped. Older posts are probed: the newest few comment ids are checked against the
 * ledger and the post is fetched only when enough of them are unseen. Any lookup or probe error
 * results in a fetch.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FreshnessGate {

  private final SourceLedger ledger;
  private final ForumContentClient forumClient;
  private final PipelineConfig pipelineConfig;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  /**
   * Gates the candidate posts of one batch.
   *
   * @param scope community the posts belong to
   * @param postIds candidate post ids, with or without the {@code t3_} prefix
   * @return the fetch list and skip counts
   */
  public FreshnessDecision resolve(String scope, List<String> postIds) {
    PipelineConfig.Freshness settings = pipelineConfig.getFreshness();
    List<String> candidates =
        postIds.stream().map(id -> ForumFields.withPrefix(id, ForumFields.POST_PREFIX)).toList();
    if (!settings.isEnabled() || candidates.isEmpty()) {
      return FreshnessDecision.fetchAll(candidates);
    }

    Map<String, Instant> processed;
    try {
      processed = ledger.lastProcessed(settings.getPipelineScopes(), candidates);
    } catch (RuntimeException e) {
      log.warn(
          "Ledger lookup failed, fetching all {} posts: {}", candidates.size(), e.getMessage());
      return FreshnessDecision.fetchAll(candidates);
    }

    Instant freshSince = clock.instant().minus(Duration.ofDays(settings.getLookbackDays()));
    List<String> toFetch = new ArrayList<>();
    int skippedFresh = 0;
    int skippedNoNew = 0;
    int probeFailures = 0;

    for (String postId : candidates) {
      Instant last = processed.get(postId);
      if (last == null) {
        toFetch.add(postId);
        continue;
      }
      if (last.isAfter(freshSince)) {
        skippedFresh++;
        continue;
      }

      try {
        int unseen = countUnseenComments(scope, postId, settings);
        if (unseen >= settings.getMinNewComments()) {
          toFetch.add(postId);
        } else {
          skippedNoNew++;
          log.debug("Skipping {}: only {} new comments since {}", postId, unseen, last);
        }
      } catch (RuntimeException e) {
        probeFailures++;
        toFetch.add(postId);
        log.warn("Freshness probe failed for {}, fetching anyway: {}", postId, e.getMessage());
      }
    }

    meterRegistry.counter("pipeline.freshness.fetch").increment(toFetch.size());
    meterRegistry.counter("pipeline.freshness.skip").increment(skippedFresh + skippedNoNew);
    meterRegistry.counter("pipeline.freshness.probe_failure").increment(probeFailures);
    log.info(
        "Freshness gate for {}: fetch={}, skippedFresh={}, skippedNoNewComments={}",
        scope,
        toFetch.size(),
        skippedFresh,
        skippedNoNew);
    return new FreshnessDecision(toFetch, skippedFresh, skippedNoNew, probeFailures);
  }

  private int countUnseenComments(
      String scope, String postId, PipelineConfig.Freshness settings) {
    List<String> recent =
        forumClient.fetchRecentCommentIds(scope, postId, settings.getProbeSampleSize());
    if (recent.isEmpty()) {
      return 0;
    }
    Map<String, Instant> seen = ledger.lastProcessed(settings.getPipelineScopes(), recent);
    return (int) recent.stream().filter(id -> !seen.containsKey(id)).count();
  }
}
