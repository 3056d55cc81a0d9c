package com.flamingo.ai.mentions.service.normalize;

import com.flamingo.ai.mentions.domain.model.Comment;
import com.flamingo.ai.mentions.domain.model.Post;
import java.util.List;

/**
 * Flattened form of one forum API thread response.
 *
 * @param post the post, or null when the response carried no usable post
 * @param comments surviving comments in depth-first API order
 */
public record NormalizedThread(Post post, List<Comment> comments) {

  public NormalizedThread {
    comments = comments == null ? List.of() : List.copyOf(comments);
  }

  public static NormalizedThread empty() {
    return new NormalizedThread(null, List.of());
  }

  public boolean hasPost() {
    return post != null;
  }

  /** The post with the comments attached. */
  public Post toPost() {
    return post == null ? null : post.withComments(comments);
  }
}
