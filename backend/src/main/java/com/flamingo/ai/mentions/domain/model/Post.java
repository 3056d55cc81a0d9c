package com.flamingo.ai.mentions.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * A forum post with its flattened comments.
 *
 * @param id forum-namespaced id ({@code t3_...})
 * @param title post title
 * @param body self text, or the title when the post has none
 * @param sourceScope community the post belongs to
 * @param author author name
 * @param url canonical post url
 * @param score non-negative vote score
 * @param createdAt creation instant
 * @param comments comments in traversal (or score) order
 */
public record Post(
    String id,
    String title,
    String body,
    String sourceScope,
    String author,
    String url,
    int score,
    Instant createdAt,
    List<Comment> comments) {

  public Post {
    comments = comments == null ? List.of() : List.copyOf(comments);
  }

  public Post withComments(List<Comment> replacement) {
    return new Post(id, title, body, sourceScope, author, url, score, createdAt, replacement);
  }

  /** Characters the post contributes to every chunk built from it. */
  public int contextLength() {
    return (title == null ? 0 : title.length()) + (body == null ? 0 : body.length());
  }

  /** Post id without its {@code t3_} kind prefix. */
  public String bareId() {
    return id != null && id.startsWith("t3_") ? id.substring(3) : id;
  }
}
