package com.flamingo.ai.mentions.service.chunking;

import java.util.List;

/**
 * Consistency check of a chunking run against its input.
 *
 * @param valid true when no issues were found
 * @param issues human-readable problems
 * @param originalCommentCount comments across the input posts
 * @param chunkedCommentCount comments across the emitted chunks
 * @param metadataCommentCount sum of metadata comment counts
 * @param emptyChunkCount chunks carrying no comments
 * @param chunkCount chunks emitted
 */
public record ChunkValidationReport(
    boolean valid,
    List<String> issues,
    int originalCommentCount,
    int chunkedCommentCount,
    int metadataCommentCount,
    int emptyChunkCount,
    int chunkCount) {

  public ChunkValidationReport {
    issues = issues == null ? List.of() : List.copyOf(issues);
  }
}
