package com.flamingo.ai.mentions.domain.model;

import java.time.Instant;
import java.util.List;

/** Diagnostic snapshot of a post as it was sent to extraction. */
public record PostSample(
    String id,
    String title,
    String sourceScope,
    String author,
    int score,
    Instant createdAt,
    int commentCount,
    List<CommentSample> sampleComments) {

  /** Diagnostic snapshot of one comment, body cut to a short snippet. */
  public record CommentSample(
      String id, String author, int score, Instant createdAt, String contentSnippet) {}
}
