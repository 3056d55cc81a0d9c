package com.flamingo.ai.mentions.exception;

import java.nio.file.Path;

/** Exception thrown when an archive file cannot be opened or decompressed. */
public class ArchiveProcessingException extends RuntimeException {

  private final Path file;

  public ArchiveProcessingException(Path file, String message, Throwable cause) {
    super(message, cause);
    this.file = file;
  }

  public Path getFile() {
    return file;
  }

  public String getUserMessage() {
    return "Archive file could not be read";
  }
}
