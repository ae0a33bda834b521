package com.scholary.narrator.synthesis;

import com.scholary.narrator.chunking.TextChunk;
import com.scholary.narrator.config.NarratorProperties;
import com.scholary.narrator.config.NarratorProperties.SynthesisProperties;
import com.scholary.narrator.logging.StructuredLogger;
import com.scholary.narrator.tts.SpeechSynthesizer;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Synthesizes one chunk and stores its audio in the job's work directory.
 *
 * <p>Each attempt runs on the call executor and is abandoned when it exceeds the per-chunk
 * timeout. Failed attempts are retried with exponential backoff and jitter up to {@code
 * maxAttempts}. The outcome is always returned as a {@link SynthesizedSegment}; nothing is thrown,
 * so one bad chunk never takes down the caller.
 */
@Component
public class SpeechSynthesisInvoker {

  private static final Logger LOGGER = LoggerFactory.getLogger(SpeechSynthesisInvoker.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final SpeechSynthesizer synthesizer;
  private final SynthesisProperties properties;
  private final AsyncTaskExecutor callExecutor;

  public SpeechSynthesisInvoker(
      SpeechSynthesizer synthesizer,
      NarratorProperties properties,
      @Qualifier("synthesisCallExecutor") AsyncTaskExecutor callExecutor) {
    this.synthesizer = synthesizer;
    this.properties = properties.synthesis();
    this.callExecutor = callExecutor;
  }

  /** File name of a chunk's audio segment. Numbering is one-based. */
  public static String segmentFileName(int sequenceIndex) {
    return String.format("chunk_%04d.mp3", sequenceIndex + 1);
  }

  /**
   * Synthesize a chunk, retrying as configured.
   *
   * <p>Re-running a chunk overwrites its segment file.
   *
   * @param chunk the chunk to speak
   * @param workDir the job's work directory
   * @return a succeeded segment pointing at the audio file, or a failed one with its reason
   */
  public SynthesizedSegment synthesizeChunk(TextChunk chunk, Path workDir) {
    int index = chunk.sequenceIndex();
    if (chunk.text().isBlank()) {
      SynthesisFailure failure =
          new SynthesisFailure(FailureKind.EMPTY_AUDIO, "Chunk has no text to synthesize");
      structuredLogger.logSynthesisFailed(index, 0, failure.kind().name(), failure.reason());
      return SynthesizedSegment.failed(index, failure, 0);
    }

    Path target = workDir.resolve(segmentFileName(index));
    int maxAttempts = properties.maxAttempts();
    long startMs = System.currentTimeMillis();
    SynthesisFailure lastFailure = null;

    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      try {
        byte[] audio = callWithTimeout(chunk);
        if (audio == null || audio.length == 0) {
          lastFailure =
              new SynthesisFailure(FailureKind.EMPTY_AUDIO, "TTS service returned no audio");
        } else {
          Files.write(target, audio);
          structuredLogger.logChunkFinished(
              index, attempt, audio.length, System.currentTimeMillis() - startMs);
          return SynthesizedSegment.succeeded(index, target, attempt);
        }
      } catch (TimeoutException e) {
        lastFailure =
            new SynthesisFailure(
                FailureKind.TIMEOUT,
                String.format("No audio within %d seconds", properties.chunkTimeoutSeconds()));
      } catch (ExecutionException e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        lastFailure = new SynthesisFailure(FailureKind.SERVICE_ERROR, describe(cause));
      } catch (IOException e) {
        lastFailure =
            new SynthesisFailure(
                FailureKind.SERVICE_ERROR, "Failed to write audio segment: " + e.getMessage());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return cancelled(index, attempt);
      }

      if (attempt < maxAttempts) {
        long backoffMs = backoffMillis(attempt);
        structuredLogger.logSynthesisRetry(
            index, attempt, maxAttempts, lastFailure.kind().name(), lastFailure.reason());
        try {
          Thread.sleep(backoffMs);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return cancelled(index, attempt);
        }
      }
    }

    structuredLogger.logSynthesisFailed(
        index, maxAttempts, lastFailure.kind().name(), lastFailure.reason());
    return SynthesizedSegment.failed(index, lastFailure, maxAttempts);
  }

  private byte[] callWithTimeout(TextChunk chunk)
      throws InterruptedException, ExecutionException, TimeoutException {
    Future<byte[]> call =
        callExecutor.submit(() -> synthesizer.synthesize(chunk.text(), chunk.voice()));
    try {
      return call.get(properties.chunkTimeoutSeconds(), TimeUnit.SECONDS);
    } finally {
      // Abandon hung or interrupted calls
      if (!call.isDone()) {
        call.cancel(true);
      }
    }
  }

  /** Exponential backoff with up to 50% jitter. */
  private long backoffMillis(int attempt) {
    long base = properties.backoffMillis() * (1L << Math.min(attempt - 1, 20));
    if (base <= 0) {
      return 0;
    }
    return base + ThreadLocalRandom.current().nextLong(base / 2 + 1);
  }

  private SynthesizedSegment cancelled(int index, int attempts) {
    LOGGER.info("Synthesis of chunk {} cancelled", index);
    return SynthesizedSegment.failed(
        index, new SynthesisFailure(FailureKind.CANCELLED, "Synthesis cancelled"), attempts);
  }

  private static String describe(Throwable cause) {
    String message = cause.getMessage();
    return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
  }
}
