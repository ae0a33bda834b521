package com.scholary.narrator.job;

/**
 * Where a running job is, as shown to pollers.
 *
 * @param currentChunk one-based number of the chunk being synthesized, 0 outside synthesis
 * @param message the human-readable status line
 */
public record JobProgress(
    ProgressStage stage, int currentChunk, int totalChunks, String message) {

  public static JobProgress extracting() {
    return new JobProgress(ProgressStage.EXTRACTING, 0, 0, "Extracting text from document...");
  }

  public static JobProgress synthesizing(int currentChunk, int totalChunks) {
    return new JobProgress(
        ProgressStage.SYNTHESIZING,
        currentChunk,
        totalChunks,
        String.format("Converting chunk %d/%d to audio...", currentChunk, totalChunks));
  }

  public static JobProgress merging(int totalChunks) {
    return new JobProgress(
        ProgressStage.MERGING,
        totalChunks,
        totalChunks,
        String.format("Merging %d audio chunks...", totalChunks));
  }
}
