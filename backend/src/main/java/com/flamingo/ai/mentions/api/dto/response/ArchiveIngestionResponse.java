package com.flamingo.ai.mentions.api.dto.response;

import com.flamingo.ai.mentions.domain.model.BatchProcessingResult;
import com.flamingo.ai.mentions.service.archive.ArchiveIngestionSummary;
import java.util.List;
import lombok.Builder;

/** Response DTO for an archive ingestion run. */
@Builder
public record ArchiveIngestionResponse(
    String parentJobId,
    String sourceScope,
    int postsReconstructed,
    int commentsReconstructed,
    int batches,
    long successfulBatches,
    int mentionsExtracted,
    List<String> failedBatches) {

  /** Creates a response from an ingestion summary. */
  public static ArchiveIngestionResponse fromSummary(ArchiveIngestionSummary summary) {
    return ArchiveIngestionResponse.builder()
        .parentJobId(summary.parentJobId())
        .sourceScope(summary.sourceScope())
        .postsReconstructed(summary.postsReconstructed())
        .commentsReconstructed(summary.commentsReconstructed())
        .batches(summary.batches().size())
        .successfulBatches(summary.successfulBatches())
        .mentionsExtracted(summary.mentionsExtracted())
        .failedBatches(
            summary.batches().stream()
                .filter(result -> !result.success())
                .map(BatchProcessingResult::batchId)
                .toList())
        .build();
  }
}
