package com.flamingo.ai.mentions.domain.model;

import java.time.Instant;
import java.util.List;
import lombok.Builder;

/**
 * Outcome of one batch. Expected failures are reported through {@code success=false} and {@code
 * error}; callers should not rely on exceptions for them.
 */
@Builder(toBuilder = true)
public record BatchProcessingResult(
    String batchId,
    String parentJobId,
    CollectionType collectionType,
    boolean success,
    String error,
    BatchMetrics metrics,
    Instant completedAt,
    BatchDetails details,
    List<Mention> rawMentionsSample) {

  public BatchProcessingResult {
    metrics = metrics == null ? BatchMetrics.empty() : metrics;
    details = details == null ? BatchDetails.empty() : details;
    rawMentionsSample = rawMentionsSample == null ? List.of() : List.copyOf(rawMentionsSample);
  }

  /** Failed result with zero-valued metrics. */
  public static BatchProcessingResult failure(BatchJob job, String error, Instant completedAt) {
    return BatchProcessingResult.builder()
        .batchId(job.batchId())
        .parentJobId(job.parentJobId())
        .collectionType(job.collectionType())
        .success(false)
        .error(error)
        .metrics(BatchMetrics.empty())
        .completedAt(completedAt)
        .build();
  }
}
