package com.flamingo.ai.mentions.exception;

import java.time.Duration;
import java.util.Optional;

/** Exception thrown when the extraction model call fails. */
public class LlmServiceException extends RuntimeException {

  private final boolean rateLimited;
  private final Duration retryAfter;
  private final String userMessage;

  public LlmServiceException(String message) {
    this(message, null, false, null);
  }

  public LlmServiceException(String message, Throwable cause) {
    this(message, cause, false, null);
  }

  public LlmServiceException(String message, boolean rateLimited) {
    this(message, null, rateLimited, null);
  }

  public LlmServiceException(
      String message, Throwable cause, boolean rateLimited, Duration retryAfter) {
    super(message, cause);
    this.rateLimited = rateLimited;
    this.retryAfter = retryAfter;
    this.userMessage =
        rateLimited
            ? "Extraction service is temporarily busy. Please try again in a moment."
            : "Extraction service is temporarily unavailable. Please try again later.";
  }

  public static LlmServiceException rateLimited(String message, Duration retryAfter) {
    return new LlmServiceException(message, null, true, retryAfter);
  }

  public boolean isRateLimited() {
    return rateLimited;
  }

  /** Backoff hint from the provider, when it sent one. */
  public Optional<Duration> getRetryAfter() {
    return Optional.ofNullable(retryAfter);
  }

  public String getUserMessage() {
    return userMessage;
  }
}
