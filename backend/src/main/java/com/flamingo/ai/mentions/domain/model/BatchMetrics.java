package com.flamingo.ai.mentions.domain.model;

import lombok.Builder;

/** Counters and timings reported for one processed batch. */
@Builder(toBuilder = true)
public record BatchMetrics(
    int postsProcessed,
    int postsSkippedFresh,
    int postsSkippedNoNewComments,
    int chunksProcessed,
    int chunksFailed,
    int mentionsExtracted,
    int entitiesCreated,
    int connectionsCreated,
    long processingTimeMs,
    long llmProcessingTimeMs,
    long dbProcessingTimeMs) {

  public static BatchMetrics empty() {
    return BatchMetrics.builder().build();
  }
}
