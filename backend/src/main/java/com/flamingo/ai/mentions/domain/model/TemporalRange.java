package com.flamingo.ai.mentions.domain.model;

import java.time.Instant;
import java.util.Collection;
import java.util.Objects;

/** Earliest and latest creation instant among a set of posts. */
public record TemporalRange(Instant earliest, Instant latest) {

  /** Range over the given posts; collapses to {@code now} when none carry a timestamp. */
  public static TemporalRange of(Collection<Post> posts, Instant now) {
    Instant earliest = null;
    Instant latest = null;
    for (Post post : posts) {
      Instant created = post.createdAt();
      if (created == null) {
        continue;
      }
      if (earliest == null || created.isBefore(earliest)) {
        earliest = created;
      }
      if (latest == null || created.isAfter(latest)) {
        latest = created;
      }
    }
    return new TemporalRange(
        Objects.requireNonNullElse(earliest, now), Objects.requireNonNullElse(latest, now));
  }
}
