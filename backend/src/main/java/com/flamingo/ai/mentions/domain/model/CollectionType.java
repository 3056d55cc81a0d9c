package com.flamingo.ai.mentions.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/** Ingestion mode a batch was collected under. */
public enum CollectionType {

  /** Live polling of a community's newest posts. */
  CHRONOLOGICAL("chronological"),

  /** Targeted keyword search. */
  KEYWORD("keyword"),

  /** Bulk reconstruction from compressed archive dumps. */
  ARCHIVE("archive"),

  /** User-triggered collection for an unknown entity. */
  ON_DEMAND("on-demand");

  private final String pipeline;

  CollectionType(String pipeline) {
    this.pipeline = pipeline;
  }

  /** Ledger pipeline name; also the wire value. */
  @JsonValue
  public String pipeline() {
    return pipeline;
  }

  @JsonCreator
  public static CollectionType fromPipeline(String value) {
    return Arrays.stream(values())
        .filter(
            type -> type.pipeline.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown collection type: " + value));
  }
}
