package com.flamingo.ai.mentions.domain.model;

/**
 * Fetch options carried by a batch job.
 *
 * @param depth comment tree depth requested from the forum API
 * @param delayBetweenRequestsMs pause between consecutive post fetches
 */
public record BatchOptions(Integer depth, long delayBetweenRequestsMs) {

  public static BatchOptions defaults() {
    return new BatchOptions(null, 0);
  }
}
