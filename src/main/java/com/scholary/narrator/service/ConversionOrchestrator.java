package com.scholary.narrator.service;

import com.scholary.narrator.audio.AudioConcatenator;
import com.scholary.narrator.audio.MergeException;
import com.scholary.narrator.chunking.ChunkLimitException;
import com.scholary.narrator.chunking.TextChunk;
import com.scholary.narrator.chunking.TextChunker;
import com.scholary.narrator.chunking.TextNormalizer;
import com.scholary.narrator.config.NarratorProperties;
import com.scholary.narrator.extraction.DocumentParseException;
import com.scholary.narrator.extraction.DocumentTextExtractor;
import com.scholary.narrator.extraction.UnsupportedDocumentException;
import com.scholary.narrator.job.ConversionJob;
import com.scholary.narrator.job.ErrorDetail;
import com.scholary.narrator.job.FailureStage;
import com.scholary.narrator.job.IllegalJobTransitionException;
import com.scholary.narrator.job.JobNotFoundException;
import com.scholary.narrator.job.JobProgress;
import com.scholary.narrator.job.JobTracker;
import com.scholary.narrator.logging.StructuredLogger;
import com.scholary.narrator.synthesis.ChunkSequencer;
import com.scholary.narrator.synthesis.FailureKind;
import com.scholary.narrator.synthesis.SequenceProgressListener;
import com.scholary.narrator.synthesis.SequenceResult;
import com.scholary.narrator.synthesis.SynthesizedSegment;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs one conversion job end to end.
 *
 * <p>Phases:
 *
 * <ol>
 *   <li>Extract and normalize the document text
 *   <li>Split it into chunks
 *   <li>Synthesize every chunk into the job's work directory
 *   <li>Merge the segments into the output MP3
 * </ol>
 *
 * <p>A failure in any phase is recorded on the job with the phase it happened in, and nothing
 * after it runs. The work directory is deleted on success and kept on failure for inspection. A
 * job cancelled from outside keeps neither its work directory nor a merged output. The staged
 * upload is always deleted.
 */
@Service
public class ConversionOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConversionOrchestrator.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  static final String EMPTY_TEXT_MESSAGE = "Text extraction failed or resulted in empty content";

  private final JobTracker tracker;
  private final DocumentTextExtractor extractor;
  private final TextNormalizer normalizer;
  private final TextChunker chunker;
  private final ChunkSequencer sequencer;
  private final AudioConcatenator concatenator;
  private final int maxChunkChars;
  private final Path tempDir;
  private final Path outputDir;

  public ConversionOrchestrator(
      JobTracker tracker,
      DocumentTextExtractor extractor,
      TextNormalizer normalizer,
      TextChunker chunker,
      ChunkSequencer sequencer,
      AudioConcatenator concatenator,
      NarratorProperties properties) {

    this.tracker = tracker;
    this.extractor = extractor;
    this.normalizer = normalizer;
    this.chunker = chunker;
    this.sequencer = sequencer;
    this.concatenator = concatenator;
    this.maxChunkChars = properties.chunking().maxChunkChars();
    this.tempDir = Paths.get(properties.tempDir());
    this.outputDir = Paths.get(properties.outputDir());

    try {
      Files.createDirectories(this.tempDir);
      Files.createDirectories(this.outputDir);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to create working directories", e);
    }
  }

  /**
   * Convert a staged document for a queued job.
   *
   * <p>Never throws: every outcome ends up on the job record.
   *
   * @param job the job, as created by the tracker
   * @param sourceFile the staged document, deleted when this method returns
   */
  public void run(ConversionJob job, Path sourceFile) {
    String jobId = job.id();
    StructuredLogger.setJobContext(jobId, job.sourceFilename(), job.voice());
    Path workDir = null;
    Path output = null;

    try {
      tracker.markProcessing(jobId, JobProgress.extracting());
      LOGGER.info(
          "Starting conversion: file={}, voice={}, chunking={}",
          job.sourceFilename(),
          job.voice(),
          job.chunkingEnabled());

      // Phase 1: extract
      String text = normalizer.normalize(extractor.extract(sourceFile, job.sourceFilename()));
      if (text.isEmpty()) {
        throw new DocumentParseException(EMPTY_TEXT_MESSAGE);
      }
      LOGGER.info("Extracted {} characters of text", text.length());
      checkCancelled();

      // Phase 2: chunk
      List<TextChunk> chunks =
          job.chunkingEnabled()
              ? chunker.chunk(text, maxChunkChars, job.voice())
              : chunker.singleChunk(text, job.voice());
      checkCancelled();

      // Phase 3: synthesize
      workDir = Files.createTempDirectory(tempDir, "tts_chunks_" + jobId + "_");
      LOGGER.info("Synthesizing {} chunks into {}", chunks.size(), workDir);
      SequenceResult result = sequencer.synthesizeAll(chunks, workDir, progressListener(jobId));
      if (!result.succeeded()) {
        failSynthesis(jobId, result, workDir);
        return;
      }
      checkCancelled();

      // Phase 4: merge
      tracker.updateProgress(jobId, JobProgress.merging(chunks.size()));
      output = outputDir.resolve(job.outputFilename());
      concatenator.concat(result.audioPaths(), output);

      tracker.complete(jobId, output);
      LOGGER.info("Conversion complete: {}", output);
      deleteRecursively(workDir);

    } catch (UnsupportedDocumentException | DocumentParseException e) {
      LOGGER.error("Text extraction failed: {}", e.getMessage(), e);
      failJob(jobId, new ErrorDetail(FailureStage.EXTRACTION, e.getMessage(), List.of(), null));
    } catch (ChunkLimitException e) {
      LOGGER.error("Chunking failed: {}", e.getMessage());
      failJob(jobId, new ErrorDetail(FailureStage.CHUNKING, e.getMessage(), List.of(), null));
    } catch (MergeException e) {
      LOGGER.error("Merge failed, keeping {}: {}", workDir, e.getMessage(), e);
      failJob(
          jobId,
          new ErrorDetail(
              FailureStage.MERGE, "Failed to merge audio: " + e.getMessage(), List.of(), workDir));
    } catch (ConversionCancelledException e) {
      LOGGER.info("Conversion cancelled");
      failJob(jobId, new ErrorDetail(FailureStage.CANCELLED, e.getMessage(), List.of(), workDir));
    } catch (IllegalJobTransitionException e) {
      // Cancelled from outside while running; nothing references these files any more
      LOGGER.info("Job left processing before the pipeline finished: {}", e.getMessage());
      deleteQuietly(output);
      if (workDir != null) {
        deleteRecursively(workDir);
      }
    } catch (JobNotFoundException e) {
      LOGGER.warn("Job record disappeared during conversion: {}", e.getMessage());
    } catch (Exception e) {
      LOGGER.error("Unexpected error during conversion", e);
      failJob(
          jobId,
          new ErrorDetail(
              FailureStage.INTERNAL, "Unexpected error: " + e.getMessage(), List.of(), workDir));
    } finally {
      deleteQuietly(sourceFile);
      StructuredLogger.clearJobContext();
    }
  }

  private SequenceProgressListener progressListener(String jobId) {
    return new SequenceProgressListener() {
      @Override
      public void onChunkStarted(int sequenceIndex, int totalChunks) {
        tracker.updateProgress(jobId, JobProgress.synthesizing(sequenceIndex + 1, totalChunks));
      }

      @Override
      public void onSegmentCompleted(SynthesizedSegment segment, int completed, int totalChunks) {
        structuredLogger.logJobProgress(jobId, completed, totalChunks, "SYNTHESIZING");
      }
    };
  }

  private void failSynthesis(String jobId, SequenceResult result, Path workDir) {
    List<SynthesizedSegment> failures = result.failures();
    SynthesizedSegment first = failures.get(0);

    boolean cancelled =
        failures.stream().allMatch(s -> s.failure().kind() == FailureKind.CANCELLED);
    if (cancelled) {
      failJob(
          jobId,
          new ErrorDetail(
              FailureStage.CANCELLED, ConversionService.CANCELLED_MESSAGE, List.of(), workDir));
      return;
    }

    String message =
        failures.size() == 1
            ? String.format(
                "Synthesis failed for chunk index %d: %s", first.sequenceIndex(), first.failure())
            : String.format(
                "Synthesis failed for chunk indices %s; first failure at %d: %s",
                result.failedIndices(),
                first.sequenceIndex(),
                first.failure());

    LOGGER.error("{}. Keeping work directory {}", message, workDir);
    failJob(
        jobId, new ErrorDetail(FailureStage.SYNTHESIS, message, result.failedIndices(), workDir));
  }

  /** Record a failure. A retained directory is removed when the record cannot point at it. */
  private void failJob(String jobId, ErrorDetail detail) {
    try {
      tracker.fail(jobId, detail);
      return;
    } catch (IllegalJobTransitionException e) {
      LOGGER.info("Job already finished, not recording {} failure", detail.stage());
    } catch (JobNotFoundException e) {
      LOGGER.warn("Cannot record failure, job record is gone: {}", jobId);
    }
    if (detail.retainedPath() != null) {
      deleteRecursively(detail.retainedPath());
    }
  }

  private static void checkCancelled() {
    if (Thread.currentThread().isInterrupted()) {
      throw new ConversionCancelledException();
    }
  }

  private static void deleteRecursively(Path dir) {
    try (Stream<Path> paths = Files.walk(dir)) {
      paths.sorted(Comparator.reverseOrder()).forEach(ConversionOrchestrator::deleteQuietly);
    } catch (IOException e) {
      LOGGER.warn("Failed to clean up work directory {}: {}", dir, e.getMessage());
    }
  }

  private static void deleteQuietly(Path path) {
    if (path == null) {
      return;
    }
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete {}: {}", path, e.getMessage());
    }
  }
}
