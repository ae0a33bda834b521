package com.scholary.narrator.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.scholary.narrator.job.ConversionJob;
import com.scholary.narrator.job.ErrorDetail;
import com.scholary.narrator.job.FailureStage;
import com.scholary.narrator.job.JobProgress;
import com.scholary.narrator.job.JobState;
import com.scholary.narrator.job.ProgressStage;
import java.util.List;

/**
 * Response for job status query.
 *
 * <p>Shows the current state of a conversion. {@code downloadUrl} and {@code filename} appear once
 * the job is complete, {@code error} once it has failed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatusResponse(
    String jobId,
    JobState state,
    ProgressStage stage,
    int currentChunk,
    int totalChunks,
    String message,
    String downloadUrl,
    String filename,
    ErrorInfo error,
    long version,
    String kibanaUrl) {

  /** {@code retainedPath} names the chunk directory kept for inspection, when there is one. */
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record ErrorInfo(
      FailureStage stage, String message, List<Integer> failedChunkIndices, String retainedPath) {}

  public static JobStatusResponse from(ConversionJob job, String kibanaUrl) {
    JobProgress progress = job.progress();
    ErrorDetail errorDetail = job.errorDetail();

    boolean complete = job.state() == JobState.COMPLETE;
    ErrorInfo error =
        errorDetail == null
            ? null
            : new ErrorInfo(
                errorDetail.stage(),
                errorDetail.message(),
                errorDetail.failedChunkIndices(),
                errorDetail.retainedPath() == null ? null : errorDetail.retainedPath().toString());

    return new JobStatusResponse(
        job.id(),
        job.state(),
        progress == null ? null : progress.stage(),
        progress == null ? 0 : progress.currentChunk(),
        progress == null ? 0 : progress.totalChunks(),
        message(job),
        complete ? "/api/jobs/" + job.id() + "/download" : null,
        complete ? job.outputFilename() : null,
        error,
        job.version(),
        kibanaUrl);
  }

  private static String message(ConversionJob job) {
    return switch (job.state()) {
      case QUEUED -> "Waiting to start...";
      case PROCESSING -> job.progress() == null ? "Processing..." : job.progress().message();
      case COMPLETE -> "Conversion complete";
      case ERROR -> job.errorDetail() == null ? "Conversion failed" : job.errorDetail().message();
    };
  }
}
