package com.flamingo.ai.mentions.domain.model;

import java.util.List;

/**
 * A bounded extraction unit: one post context plus one or more complete comment threads.
 *
 * @param post post context, flagged for post-level extraction on the first chunk only
 * @param comments comments of the grouped threads in thread order
 */
public record Chunk(ChunkPost post, List<Comment> comments) {

  public Chunk {
    comments = comments == null ? List.of() : List.copyOf(comments);
  }

  public boolean extractFromPost() {
    return post.extractFromPost();
  }

  /** Total characters of post context and comment bodies. */
  public int charLength() {
    int length =
        (post.title() == null ? 0 : post.title().length())
            + (post.body() == null ? 0 : post.body().length());
    for (Comment comment : comments) {
      length += comment.length();
    }
    return length;
  }
}
