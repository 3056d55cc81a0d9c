package com.flamingo.ai.mentions.service.batch;

import com.flamingo.ai.mentions.domain.model.Comment;
import com.flamingo.ai.mentions.domain.model.Mention;
import com.flamingo.ai.mentions.domain.model.Post;
import com.flamingo.ai.mentions.domain.model.SourceType;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Lookup tables over a batch's own posts and comments, used to fill the source fields of extracted
 * mentions. The extraction model is never asked to echo source text back.
 */
final class SourceEnrichment {

  static final String UNKNOWN_SCOPE = "unknown";

  private final Map<String, String> contentById = new HashMap<>();
  private final Map<String, String> postIdById = new HashMap<>();
  private final Map<String, SourceMetadata> metadataById = new HashMap<>();
  private final Map<String, String> postContextById = new HashMap<>();

  private record SourceMetadata(
      SourceType type, int upvotes, String url, Instant createdAt, String scope) {}

  private SourceEnrichment() {}

  static SourceEnrichment from(List<Post> posts) {
    SourceEnrichment enrichment = new SourceEnrichment();
    for (Post post : posts) {
      String postBody = post.body() != null ? post.body() : "";
      String scope = post.sourceScope() != null ? post.sourceScope() : UNKNOWN_SCOPE;
      if (post.id() == null) {
        continue;
      }
      enrichment.contentById.put(post.id(), postBody);
      enrichment.postIdById.put(post.id(), post.id());
      enrichment.postContextById.put(post.id(), postBody);
      enrichment.metadataById.put(
          post.id(),
          new SourceMetadata(SourceType.POST, post.score(), post.url(), post.createdAt(), scope));

      for (Comment comment : post.comments()) {
        if (comment.id() == null) {
          continue;
        }
        enrichment.contentById.put(comment.id(), comment.body() != null ? comment.body() : "");
        enrichment.postIdById.put(comment.id(), post.id());
        enrichment.postContextById.put(comment.id(), postBody);
        enrichment.metadataById.put(
            comment.id(),
            new SourceMetadata(
                SourceType.COMMENT, comment.score(), comment.url(), comment.createdAt(), scope));
      }
    }
    return enrichment;
  }

  /** Owning post of a post or comment id, or null when the id is not part of this batch. */
  String postIdOf(String sourceId) {
    return sourceId == null ? null : postIdById.get(sourceId);
  }

  /**
   * Overwrites each mention's source fields from the batch tables, keeping the mention's own
   * values where the source id is unknown.
   */
  void apply(List<Mention> mentions, Instant now) {
    for (Mention mention : mentions) {
      String sourceId = mention.getSourceId();
      SourceMetadata metadata = sourceId == null ? null : metadataById.get(sourceId);
      String content = sourceId == null ? null : contentById.get(sourceId);

      if (content != null && !content.isEmpty()) {
        mention.setSourceContent(content);
      } else if (mention.getSourceContent() == null) {
        mention.setSourceContent("");
      }

      if (metadata != null) {
        mention.setSourceType(metadata.type());
        mention.setSourceUpvotes(metadata.upvotes());
        mention.setSourceUrl(metadata.url() != null ? metadata.url() : "");
        mention.setSourceCreatedAt(metadata.createdAt() != null ? metadata.createdAt() : now);
        mention.setSourceScope(metadata.scope());
      } else {
        mention.setSourceUpvotes(
            mention.getSourceUpvotes() != null ? mention.getSourceUpvotes() : 0);
        mention.setSourceUrl(mention.getSourceUrl() != null ? mention.getSourceUrl() : "");
        mention.setSourceCreatedAt(
            mention.getSourceCreatedAt() != null ? mention.getSourceCreatedAt() : now);
        mention.setSourceScope(
            mention.getSourceScope() != null ? mention.getSourceScope() : UNKNOWN_SCOPE);
      }

      String context = sourceId == null ? null : postContextById.get(sourceId);
      mention.setPostContext(context != null ? context : "");
    }
  }
}
