package com.scholary.narrator.job;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Snapshot of a conversion job.
 *
 * <p>Immutable: every transition publishes a new record with a higher {@code version}. {@code
 * resultPath} is set only in {@link JobState#COMPLETE}, {@code errorDetail} only in {@link
 * JobState#ERROR}.
 */
public record ConversionJob(
    String id,
    JobState state,
    JobProgress progress,
    Path resultPath,
    ErrorDetail errorDetail,
    String voice,
    boolean chunkingEnabled,
    String sourceFilename,
    String outputFilename,
    Instant createdAt,
    Instant updatedAt,
    long version) {

  static ConversionJob queued(
      String id,
      String voice,
      boolean chunkingEnabled,
      String sourceFilename,
      String outputFilename,
      Instant now) {
    return new ConversionJob(
        id,
        JobState.QUEUED,
        null,
        null,
        null,
        voice,
        chunkingEnabled,
        sourceFilename,
        outputFilename,
        now,
        now,
        1);
  }

  ConversionJob withProgress(JobProgress newProgress, Instant now) {
    return next(state, newProgress, resultPath, errorDetail, now);
  }

  ConversionJob processing(JobProgress newProgress, Instant now) {
    return next(JobState.PROCESSING, newProgress, null, null, now);
  }

  ConversionJob completed(Path result, Instant now) {
    return next(JobState.COMPLETE, progress, result, null, now);
  }

  ConversionJob failed(ErrorDetail detail, Instant now) {
    return next(JobState.ERROR, progress, null, detail, now);
  }

  public boolean isTerminal() {
    return state.isTerminal();
  }

  private ConversionJob next(
      JobState newState,
      JobProgress newProgress,
      Path newResult,
      ErrorDetail newError,
      Instant now) {
    return new ConversionJob(
        id,
        newState,
        newProgress,
        newResult,
        newError,
        voice,
        chunkingEnabled,
        sourceFilename,
        outputFilename,
        createdAt,
        now,
        version + 1);
  }
}
