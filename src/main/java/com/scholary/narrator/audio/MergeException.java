package com.scholary.narrator.audio;

/**
 * Exception thrown when audio segments cannot be merged.
 *
 * <p>This could be due to a missing ffmpeg binary, a non-zero exit, a timeout or a missing segment.
 */
public class MergeException extends RuntimeException {

  public MergeException(String message) {
    super(message);
  }

  public MergeException(String message, Throwable cause) {
    super(message, cause);
  }
}
