package com.flamingo.ai.mentions.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Whether a mention was extracted from a post or from a comment. */
public enum SourceType {
  POST,
  COMMENT;

  @JsonValue
  public String wireValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static SourceType fromWire(String value) {
    return value == null ? null : SourceType.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
