package com.scholary.narrator.synthesis;

import com.scholary.narrator.chunking.TextChunk;
import com.scholary.narrator.config.NarratorProperties;
import com.scholary.narrator.logging.StructuredLogger;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Drives every chunk of a document through the synthesis invoker.
 *
 * <p>Up to {@code parallelism} chunks are in flight at once, but results are consumed strictly in
 * ascending {@code sequenceIndex} order. Whatever order the TTS calls finish in, the listener and
 * the returned segments see chunk 0, then 1, then 2. A failure is therefore always detected at the
 * lowest failing index, and under {@link FailurePolicy#FAIL_FAST} nothing after it is kept.
 */
@Component
public class ChunkSequencer {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkSequencer.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final SpeechSynthesisInvoker invoker;
  private final AsyncTaskExecutor executor;
  private final int parallelism;
  private final FailurePolicy failurePolicy;

  public ChunkSequencer(
      SpeechSynthesisInvoker invoker,
      NarratorProperties properties,
      @Qualifier("synthesisExecutor") AsyncTaskExecutor executor) {
    this.invoker = invoker;
    this.executor = executor;
    this.parallelism = Math.max(1, properties.synthesis().parallelism());
    this.failurePolicy = properties.synthesis().failurePolicy();
  }

  /**
   * Synthesize all chunks.
   *
   * @param chunks chunks in index order
   * @param workDir the job's work directory, where segment files are written
   * @param listener progress callbacks, invoked in index order
   * @return the ordered segments and any failures
   */
  public SequenceResult synthesizeAll(
      List<TextChunk> chunks, Path workDir, SequenceProgressListener listener) {
    int total = chunks.size();
    LOGGER.info(
        "Synthesizing {} chunks: parallelism={}, failurePolicy={}",
        total,
        parallelism,
        failurePolicy);

    List<Future<SynthesizedSegment>> inFlight = new ArrayList<>(total);
    List<SynthesizedSegment> segments = new ArrayList<>(total);
    List<SynthesizedSegment> failures = new ArrayList<>();

    try {
      for (int index = 0; index < total; index++) {
        while (inFlight.size() < total && inFlight.size() < index + parallelism) {
          TextChunk next = chunks.get(inFlight.size());
          inFlight.add(submit(next, workDir, total));
        }

        listener.onChunkStarted(index, total);
        SynthesizedSegment segment = await(inFlight.get(index), index);
        segments.add(segment);
        listener.onSegmentCompleted(segment, index + 1, total);

        if (segment.isFailed()) {
          failures.add(segment);
          if (failurePolicy == FailurePolicy.FAIL_FAST
              || segment.failure().kind() == FailureKind.CANCELLED) {
            LOGGER.warn(
                "Chunk {} failed, abandoning remaining {} chunks",
                index,
                total - index - 1);
            break;
          }
        }
      }
    } finally {
      cancelOutstanding(inFlight);
    }

    if (failures.isEmpty()) {
      LOGGER.info("All {} chunks synthesized", total);
    } else {
      LOGGER.warn(
          "{} of {} chunks failed: indices={}",
          failures.size(),
          total,
          failures.stream().map(SynthesizedSegment::sequenceIndex).toList());
    }
    return new SequenceResult(segments, failures);
  }

  private Future<SynthesizedSegment> submit(TextChunk chunk, Path workDir, int total) {
    return executor.submit(
        () -> {
          structuredLogger.logChunkStarted(chunk.sequenceIndex(), total, chunk.length());
          return invoker.synthesizeChunk(chunk, workDir);
        });
  }

  private SynthesizedSegment await(Future<SynthesizedSegment> future, int index) {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return cancelled(index);
    } catch (CancellationException e) {
      return cancelled(index);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      LOGGER.error("Unexpected error synthesizing chunk {}", index, cause);
      return SynthesizedSegment.failed(
          index, new SynthesisFailure(FailureKind.SERVICE_ERROR, String.valueOf(cause)), 0);
    }
  }

  private static SynthesizedSegment cancelled(int index) {
    return SynthesizedSegment.failed(
        index, new SynthesisFailure(FailureKind.CANCELLED, "Synthesis cancelled"), 0);
  }

  private static void cancelOutstanding(List<Future<SynthesizedSegment>> futures) {
    for (Future<SynthesizedSegment> future : futures) {
      if (!future.isDone()) {
        future.cancel(true);
      }
    }
  }
}
