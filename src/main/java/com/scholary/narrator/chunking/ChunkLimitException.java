package com.scholary.narrator.chunking;

/**
 * Exception thrown when text cannot be chunked within the configured limits.
 *
 * <p>Not retryable: the same text and limits always produce the same outcome.
 */
public class ChunkLimitException extends RuntimeException {

  public ChunkLimitException(String message) {
    super(message);
  }
}
