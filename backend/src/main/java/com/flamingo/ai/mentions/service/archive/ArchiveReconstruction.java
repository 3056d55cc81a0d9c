package com.flamingo.ai.mentions.service.archive;

import com.flamingo.ai.mentions.domain.model.Post;
import java.util.List;

/**
 * Posts rebuilt from one scope's archive pair.
 *
 * @param sourceScope the community the archive belongs to
 * @param posts posts ascending by creation time, comments descending by score
 * @param submissions metrics of the submissions file
 * @param comments metrics of the comments file
 */
public record ArchiveReconstruction(
    String sourceScope,
    List<Post> posts,
    ArchiveFileMetrics submissions,
    ArchiveFileMetrics comments) {

  public ArchiveReconstruction {
    posts = posts == null ? List.of() : List.copyOf(posts);
  }

  public int commentCount() {
    return posts.stream().mapToInt(post -> post.comments().size()).sum();
  }
}
