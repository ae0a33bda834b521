package com.scholary.narrator.job;

/**
 * Exception thrown when a job is asked to leave a terminal state or to skip a state.
 *
 * <p>The stored record is left untouched.
 */
public class IllegalJobTransitionException extends RuntimeException {

  private final String jobId;
  private final JobState from;
  private final JobState to;

  public IllegalJobTransitionException(String jobId, JobState from, JobState to) {
    super(String.format("Job %s cannot move from %s to %s", jobId, from, to));
    this.jobId = jobId;
    this.from = from;
    this.to = to;
  }

  public String getJobId() {
    return jobId;
  }

  public JobState getFrom() {
    return from;
  }

  public JobState getTo() {
    return to;
  }
}
