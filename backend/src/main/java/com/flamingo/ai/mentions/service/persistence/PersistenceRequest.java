package com.flamingo.ai.mentions.service.persistence;

import com.flamingo.ai.mentions.domain.model.CollectionType;
import com.flamingo.ai.mentions.domain.model.Mention;
import com.flamingo.ai.mentions.domain.model.Post;
import com.flamingo.ai.mentions.domain.model.SourceBreakdown;
import com.flamingo.ai.mentions.domain.model.TemporalRange;
import java.util.List;
import java.util.Set;
import lombok.Builder;

/**
 * Cleaned output of one batch, ready to be stored.
 *
 * @param mentions normalized, deduplicated mentions
 * @param posts posts the batch processed, recorded in the source ledger
 * @param unsettledSourceIds post and comment ids left out of the ledger because a chunk carrying
 *     them failed extraction
 */
@Builder
public record PersistenceRequest(
    List<Mention> mentions,
    List<Post> posts,
    Set<String> unsettledSourceIds,
    String batchId,
    CollectionType collectionType,
    String sourceScope,
    SourceBreakdown sourceBreakdown,
    TemporalRange temporalRange) {

  public PersistenceRequest {
    mentions = mentions == null ? List.of() : List.copyOf(mentions);
    posts = posts == null ? List.of() : List.copyOf(posts);
    unsettledSourceIds = unsettledSourceIds == null ? Set.of() : Set.copyOf(unsettledSourceIds);
  }
}
