package com.scholary.narrator.job;

import java.nio.file.Path;
import java.util.List;

/**
 * Why a job ended in {@link JobState#ERROR}.
 *
 * @param failedChunkIndices zero-based indices of the chunks that failed, empty outside synthesis
 * @param retainedPath the work directory kept for inspection, or null
 */
public record ErrorDetail(
    FailureStage stage, String message, List<Integer> failedChunkIndices, Path retainedPath) {

  public ErrorDetail {
    failedChunkIndices = failedChunkIndices == null ? List.of() : List.copyOf(failedChunkIndices);
  }

  public static ErrorDetail of(FailureStage stage, String message) {
    return new ErrorDetail(stage, message, List.of(), null);
  }
}
