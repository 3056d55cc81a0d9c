package com.flamingo.ai.mentions.domain.model;

import java.time.Instant;
import java.util.List;
import lombok.Builder;

/**
 * One unit of work on the batch queue. Either {@code postIds} (to be fetched) or {@code posts}
 * (already reconstructed, e.g. from an archive) is populated.
 */
@Builder(toBuilder = true)
public record BatchJob(
    String batchId,
    String parentJobId,
    CollectionType collectionType,
    String sourceScope,
    int batchNumber,
    int totalBatches,
    Instant createdAt,
    int priority,
    List<String> postIds,
    List<Post> posts,
    BatchOptions options) {

  public BatchJob {
    postIds = postIds == null ? List.of() : List.copyOf(postIds);
    posts = posts == null ? List.of() : List.copyOf(posts);
    options = options == null ? BatchOptions.defaults() : options;
  }

  public boolean hasPrebuiltPosts() {
    return !posts.isEmpty();
  }

  public boolean isFinalBatch() {
    return totalBatches > 0 && batchNumber == totalBatches;
  }
}
