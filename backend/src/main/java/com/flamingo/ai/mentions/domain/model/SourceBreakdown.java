package com.flamingo.ai.mentions.domain.model;

/** Number of posts in a batch per collection type. */
public record SourceBreakdown(int archive, int chronological, int keyword, int onDemand) {

  public static SourceBreakdown of(CollectionType type, int posts) {
    return switch (type) {
      case ARCHIVE -> new SourceBreakdown(posts, 0, 0, 0);
      case CHRONOLOGICAL -> new SourceBreakdown(0, posts, 0, 0);
      case KEYWORD -> new SourceBreakdown(0, 0, posts, 0);
      case ON_DEMAND -> new SourceBreakdown(0, 0, 0, posts);
    };
  }
}
