package com.scholary.narrator.job;

/**
 * Lifecycle of a conversion job.
 *
 * <p>{@code QUEUED -> PROCESSING -> COMPLETE | ERROR}, plus {@code QUEUED -> ERROR} for jobs
 * cancelled or rejected before they start. {@code COMPLETE} and {@code ERROR} are terminal.
 */
public enum JobState {
  QUEUED,
  PROCESSING,
  COMPLETE,
  ERROR;

  public boolean isTerminal() {
    return this == COMPLETE || this == ERROR;
  }

  public boolean canMoveTo(JobState target) {
    return switch (this) {
      case QUEUED -> target == PROCESSING || target == ERROR;
      case PROCESSING -> target == COMPLETE || target == ERROR;
      case COMPLETE, ERROR -> false;
    };
  }
}
