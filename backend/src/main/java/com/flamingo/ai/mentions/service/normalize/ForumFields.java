package com.flamingo.ai.mentions.service.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Clock;
import java.time.Instant;

/** Field readers shared by the API normalizer and the archive reconstructor. */
public final class ForumFields {

  public static final String POST_PREFIX = "t3_";
  public static final String COMMENT_PREFIX = "t1_";
  public static final String PERMALINK_HOST = "https://reddit.com";
  public static final String DELETED = "[deleted]";
  public static final String REMOVED = "[removed]";

  // Epoch values above this are already milliseconds
  private static final double MILLIS_THRESHOLD = 10_000_000_000d;

  private ForumFields() {}

  /** Non-empty textual value of {@code field}, or null. */
  public static String text(JsonNode node, String field) {
    JsonNode value = node == null ? null : node.get(field);
    if (value == null || !value.isTextual()) {
      return null;
    }
    String text = value.asText();
    return text.isEmpty() ? null : text;
  }

  public static String textOr(JsonNode node, String field, String fallback) {
    String text = text(node, field);
    return text != null ? text : fallback;
  }

  /** Vote score clamped at zero; non-numeric values count as zero. */
  public static int score(JsonNode node) {
    JsonNode value = node == null ? null : node.get("score");
    if (value == null || !value.isNumber()) {
      return 0;
    }
    return Math.max(0, value.asInt());
  }

  /**
   * Converts an epoch timestamp (seconds, or milliseconds when large) to an instant. Missing or
   * malformed values fall back to the clock's current instant.
   */
  public static Instant timestamp(JsonNode node, String field, Clock clock) {
    JsonNode value = node == null ? null : node.get(field);
    double epoch;
    if (value == null || value.isNull()) {
      return clock.instant();
    } else if (value.isNumber()) {
      epoch = value.asDouble();
    } else if (value.isTextual()) {
      try {
        epoch = Double.parseDouble(value.asText().trim());
      } catch (NumberFormatException e) {
        return clock.instant();
      }
    } else {
      return clock.instant();
    }
    if (Double.isNaN(epoch) || Double.isInfinite(epoch)) {
      return clock.instant();
    }
    long millis = epoch > MILLIS_THRESHOLD ? (long) epoch : (long) (epoch * 1000);
    return Instant.ofEpochMilli(millis);
  }

  /** Prefixes {@code id} with {@code prefix} unless it already carries a kind prefix. */
  public static String withPrefix(String id, String prefix) {
    if (id == null || id.isEmpty()) {
      return null;
    }
    if (id.startsWith(POST_PREFIX) || id.startsWith(COMMENT_PREFIX)) {
      return id;
    }
    return prefix + id;
  }

  /** Parent reference when it points at a comment or a post; anything else is null. */
  public static String parentId(JsonNode node) {
    String parent = text(node, "parent_id");
    if (parent == null) {
      return null;
    }
    String trimmed = parent.trim();
    return trimmed.startsWith(COMMENT_PREFIX) || trimmed.startsWith(POST_PREFIX) ? trimmed : null;
  }

  public static String permalink(JsonNode node) {
    String permalink = text(node, "permalink");
    return permalink != null ? PERMALINK_HOST + permalink : null;
  }

  /** True for bodies that carry no content: blank, deleted or removed. */
  public static boolean isRemoved(String body) {
    return body == null || body.isBlank() || DELETED.equals(body) || REMOVED.equals(body);
  }
}
