package com.flamingo.ai.mentions.domain.model;

import java.util.List;

/**
 * Bookkeeping for one chunk, index-aligned with the chunk list it was produced with.
 *
 * @param chunkId {@code chunk_{rootId}}, {@code chunk_{postId}_group_{n}}, {@code
 *     chunk_post_{postId}} or {@code chunk_orphaned_{postId}}
 * @param commentCount comments in the chunk
 * @param rootCommentScore highest root score among the chunk's threads
 * @param estimatedProcessingSeconds rough extraction time estimate
 * @param estimatedTokenCount token estimate of the chunk's characters
 * @param threadRootId root comment id, {@code group:{ids}}, the post id, or {@code orphaned}
 * @param rootCommentIds root comment ids of the grouped threads
 * @param rootCommentScores root scores aligned with {@code rootCommentIds}
 * @param postId owning post
 * @param postChunkIndex sequence of this chunk within its post
 */
public record ChunkMetadata(
    String chunkId,
    int commentCount,
    int rootCommentScore,
    double estimatedProcessingSeconds,
    int estimatedTokenCount,
    String threadRootId,
    List<String> rootCommentIds,
    List<Integer> rootCommentScores,
    String postId,
    int postChunkIndex) {

  public static final String ORPHANED_ROOT = "orphaned";

  public ChunkMetadata {
    rootCommentIds = rootCommentIds == null ? List.of() : List.copyOf(rootCommentIds);
    rootCommentScores = rootCommentScores == null ? List.of() : List.copyOf(rootCommentScores);
  }
}
