package com.flamingo.ai.mentions.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String BATCH_INVALID = "BATCH_001";
  public static final String ARCHIVE_UNREADABLE = "ARCHIVE_001";
  public static final String LLM_UNAVAILABLE = "LLM_001";
  public static final String LLM_RATE_LIMITED = "LLM_002";
  public static final String FORUM_UNAVAILABLE = "FORUM_001";
  public static final String FORUM_RATE_LIMITED = "FORUM_002";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  private final String message;

  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
