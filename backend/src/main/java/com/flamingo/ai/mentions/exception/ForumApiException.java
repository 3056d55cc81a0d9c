package com.flamingo.ai.mentions.exception;

/** Exception thrown when the forum API call fails. */
public class ForumApiException extends RuntimeException {

  private final int statusCode;

  public ForumApiException(String message, int statusCode) {
    super(message);
    this.statusCode = statusCode;
  }

  public ForumApiException(String message, int statusCode, Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
  }

  public int getStatusCode() {
    return statusCode;
  }

  public boolean isRateLimited() {
    return statusCode == 429;
  }

  public String getUserMessage() {
    return isRateLimited()
        ? "Forum API rate limit reached. Please try again later."
        : "Forum API is temporarily unavailable.";
  }
}
