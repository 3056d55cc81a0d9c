package com.flamingo.ai.mentions.service.freshness;

import java.util.List;

/**
 * Which candidate posts need fetching.
 *
 * @param toFetch post ids to fetch, in candidate order
 * @param skippedFresh posts processed inside the lookback window
 * @param skippedNoNewComments stale posts whose probe found too few unseen comments
 * @param probeFailures probes that failed and were fetched anyway
 */
public record FreshnessDecision(
    List<String> toFetch, int skippedFresh, int skippedNoNewComments, int probeFailures) {

  public FreshnessDecision {
    toFetch = toFetch == null ? List.of() : List.copyOf(toFetch);
  }

  public static FreshnessDecision fetchAll(List<String> postIds) {
    return new FreshnessDecision(postIds, 0, 0, 0);
  }

  public boolean nothingToFetch() {
    return toFetch.isEmpty();
  }
}
