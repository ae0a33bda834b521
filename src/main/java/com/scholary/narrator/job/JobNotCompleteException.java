package com.scholary.narrator.job;

/** Exception thrown when a result is requested before the job has completed. */
public class JobNotCompleteException extends RuntimeException {

  private final String jobId;
  private final JobState state;

  public JobNotCompleteException(String jobId, JobState state) {
    super(String.format("Job %s is not complete (state=%s)", jobId, state));
    this.jobId = jobId;
    this.state = state;
  }

  public String getJobId() {
    return jobId;
  }

  public JobState getState() {
    return state;
  }
}
