package com.flamingo.ai.mentions.service.archive;

import com.flamingo.ai.mentions.domain.model.BatchProcessingResult;
import java.util.List;

/**
 * Outcome of ingesting one scope's archive.
 *
 * @param parentJobId {@code archive-{scope}-{epochMillis}}
 * @param sourceScope community ingested
 * @param postsReconstructed posts rebuilt from the archive pair
 * @param commentsReconstructed comments attached to those posts
 * @param batches results of every batch, in order
 */
public record ArchiveIngestionSummary(
    String parentJobId,
    String sourceScope,
    int postsReconstructed,
    int commentsReconstructed,
    List<BatchProcessingResult> batches) {

  public ArchiveIngestionSummary {
    batches = batches == null ? List.of() : List.copyOf(batches);
  }

  public long successfulBatches() {
    return batches.stream().filter(BatchProcessingResult::success).count();
  }

  public int mentionsExtracted() {
    return batches.stream().mapToInt(b -> b.metrics().mentionsExtracted()).sum();
  }
}
