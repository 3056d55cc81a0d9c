package com.flamingo.ai.mentions.domain.model;

import java.time.Instant;

/**
 * A single forum comment, flattened out of its reply tree.
 *
 * @param id forum-namespaced id ({@code t1_...})
 * @param body non-empty comment text
 * @param author author name, {@code [deleted]} when unknown
 * @param score non-negative vote score
 * @param createdAt creation instant
 * @param parentId parent comment or post id; null or the post id means top-level
 * @param url permalink, may be empty
 */
public record Comment(
    String id,
    String body,
    String author,
    int score,
    Instant createdAt,
    String parentId,
    String url) {

  public int length() {
    return body == null ? 0 : body.length();
  }
}
