package com.scholary.narrator.tts;

/**
 * Exception thrown when a TTS service call fails.
 *
 * <p>This could be due to network issues, service unavailability, rejected input or invalid
 * responses.
 */
public class TtsServiceException extends RuntimeException {

  private final int statusCode;

  public TtsServiceException(String message) {
    this(message, -1, null);
  }

  public TtsServiceException(String message, Throwable cause) {
    this(message, -1, cause);
  }

  public TtsServiceException(String message, int statusCode) {
    this(message, statusCode, null);
  }

  private TtsServiceException(String message, int statusCode, Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
  }

  /** HTTP status returned by the service, or -1 when no response was received. */
  public int getStatusCode() {
    return statusCode;
  }
}
