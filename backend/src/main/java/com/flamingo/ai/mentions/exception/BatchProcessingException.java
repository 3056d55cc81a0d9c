package com.flamingo.ai.mentions.exception;

/** Exception thrown when a batch job cannot be processed at all. */
public class BatchProcessingException extends RuntimeException {

  private final String batchId;
  private final String userMessage;

  public BatchProcessingException(String batchId, String message) {
    super(message);
    this.batchId = batchId;
    this.userMessage = "Failed to process batch";
  }

  public BatchProcessingException(String batchId, String message, Throwable cause) {
    super(message, cause);
    this.batchId = batchId;
    this.userMessage = "Failed to process batch";
  }

  public BatchProcessingException(String batchId, String message, String userMessage) {
    super(message);
    this.batchId = batchId;
    this.userMessage = userMessage;
  }

  public String getBatchId() {
    return batchId;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
