package com.scholary.narrator.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Provides methods to log events with structured fields that can be queried in Kibana.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log chunk started event. */
  public void logChunkStarted(int chunkIndex, int totalChunks, int textLength) {
    try {
      MDC.put("event_type", "chunk_started");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("totalChunks", String.valueOf(totalChunks));
      MDC.put("textLength", String.valueOf(textLength));

      logger.debug(
          "Chunk started: index={}, chunk={}/{}, chars={}",
          chunkIndex,
          chunkIndex + 1,
          totalChunks,
          textLength);
    } finally {
      clearEventFields();
    }
  }

  /** Log chunk finished event. */
  public void logChunkFinished(int chunkIndex, int attempts, long audioBytes, long synthesizeMs) {
    try {
      MDC.put("event_type", "chunk_finished");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("attempt", String.valueOf(attempts));
      MDC.put("audioBytes", String.valueOf(audioBytes));
      MDC.put("synthesizeMs", String.valueOf(synthesizeMs));

      logger.debug(
          "Chunk finished: index={}, attempts={}, audio={} bytes, synthesize={}ms",
          chunkIndex,
          attempts,
          audioBytes,
          synthesizeMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log synthesis retry event. */
  public void logSynthesisRetry(
      int chunkIndex, int attempt, int maxAttempts, String errorType, String message) {
    try {
      MDC.put("event_type", "synthesis_retry");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxAttempts", String.valueOf(maxAttempts));
      MDC.put("errorType", errorType);

      logger.warn(
          "Synthesis retry: chunk={}, attempt={}/{}, error={}, message={}",
          chunkIndex,
          attempt,
          maxAttempts,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log synthesis failure event. */
  public void logSynthesisFailed(int chunkIndex, int attempts, String errorType, String message) {
    try {
      MDC.put("event_type", "synthesis_failed");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("attempt", String.valueOf(attempts));
      MDC.put("errorType", errorType);

      logger.error(
          "Synthesis failed: chunk={}, attempts={}, error={}, message={}",
          chunkIndex,
          attempts,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log job progress event. */
  public void logJobProgress(String jobId, int chunksProcessed, int totalChunks, String phase) {
    int percentComplete = totalChunks == 0 ? 0 : (chunksProcessed * 100) / totalChunks;
    try {
      MDC.put("event_type", "job_progress");
      MDC.put("chunksProcessed", String.valueOf(chunksProcessed));
      MDC.put("totalChunks", String.valueOf(totalChunks));
      MDC.put("percentComplete", String.valueOf(percentComplete));
      MDC.put("phase", phase);

      logger.info(
          "Job progress: jobId={}, phase={}, chunks={}/{}, progress={}%",
          jobId,
          phase,
          chunksProcessed,
          totalChunks,
          percentComplete);
    } finally {
      clearEventFields();
    }
  }

  /** Log job state transition event. */
  public void logJobState(String jobId, String fromState, String toState, long version) {
    try {
      MDC.put("event_type", "job_state");
      MDC.put("fromState", fromState);
      MDC.put("toState", toState);
      MDC.put("version", String.valueOf(version));

      logger.info("Job state: jobId={}, {} -> {}, version={}", jobId, fromState, toState, version);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String sourceFile, String voice) {
    MDC.put("jobId", jobId);
    MDC.put("sourceFile", sourceFile);
    MDC.put("voice", voice);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("sourceFile");
    MDC.remove("voice");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("chunk_index");
    MDC.remove("totalChunks");
    MDC.remove("textLength");
    MDC.remove("attempt");
    MDC.remove("maxAttempts");
    MDC.remove("audioBytes");
    MDC.remove("synthesizeMs");
    MDC.remove("errorType");
    MDC.remove("chunksProcessed");
    MDC.remove("percentComplete");
    MDC.remove("phase");
    MDC.remove("fromState");
    MDC.remove("toState");
    MDC.remove("version");
  }
}
