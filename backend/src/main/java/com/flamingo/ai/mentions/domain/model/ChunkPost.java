package com.flamingo.ai.mentions.domain.model;

import java.time.Instant;

/**
 * Post context sent with a chunk. The first chunk of a post carries the full context; later
 * chunks carry a light one without author, url, score or timestamp.
 */
public record ChunkPost(
    String id,
    String title,
    String body,
    String sourceScope,
    String author,
    String url,
    Integer score,
    Instant createdAt,
    boolean extractFromPost) {

  public static ChunkPost full(Post post) {
    return new ChunkPost(
        post.id(),
        post.title(),
        post.body(),
        post.sourceScope(),
        post.author(),
        post.url(),
        post.score(),
        post.createdAt(),
        true);
  }

  public static ChunkPost light(Post post) {
    return new ChunkPost(
        post.id(), post.title(), post.body(), post.sourceScope(), null, null, null, null, false);
  }
}
