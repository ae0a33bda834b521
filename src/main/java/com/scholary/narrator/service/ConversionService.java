package com.scholary.narrator.service;

import com.scholary.narrator.extraction.DocumentTextExtractor;
import com.scholary.narrator.extraction.UnsupportedDocumentException;
import com.scholary.narrator.job.ConversionJob;
import com.scholary.narrator.job.ErrorDetail;
import com.scholary.narrator.job.FailureStage;
import com.scholary.narrator.job.JobNotCompleteException;
import com.scholary.narrator.job.JobState;
import com.scholary.narrator.job.JobTracker;
import com.scholary.narrator.tts.VoiceCatalog;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

/**
 * Entry point for conversions, used by the REST API and the CLI.
 *
 * <p>Submissions return immediately with a job id; the pipeline runs on the conversion executor
 * and reports through the job tracker, which is all status queries ever read.
 */
@Service
public class ConversionService {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConversionService.class);

  static final String CANCELLED_MESSAGE = "Conversion cancelled";

  private final JobTracker tracker;
  private final ConversionOrchestrator orchestrator;
  private final DocumentTextExtractor extractor;
  private final VoiceCatalog voiceCatalog;
  private final AsyncTaskExecutor executor;

  private final Map<String, RunningConversion> running = new ConcurrentHashMap<>();

  public ConversionService(
      JobTracker tracker,
      ConversionOrchestrator orchestrator,
      DocumentTextExtractor extractor,
      VoiceCatalog voiceCatalog,
      @Qualifier("conversionExecutor") AsyncTaskExecutor executor) {
    this.tracker = tracker;
    this.orchestrator = orchestrator;
    this.extractor = extractor;
    this.voiceCatalog = voiceCatalog;
    this.executor = executor;
  }

  /**
   * Queue a conversion.
   *
   * @return the new job's id
   * @throws UnsupportedDocumentException if the document type is not supported
   * @throws TaskRejectedException if the conversion queue is full; the job is marked failed
   */
  public String submit(ConversionRequest request) {
    ConversionJob job = createJob(request);

    try {
      Future<?> future =
          executor.submit(
              () -> {
                try {
                  orchestrator.run(job, request.sourceFile());
                } finally {
                  running.remove(job.id());
                }
              });
      running.put(job.id(), new RunningConversion(future, request.sourceFile()));
      if (future.isDone()) {
        running.remove(job.id());
      }
    } catch (TaskRejectedException e) {
      LOGGER.warn("Conversion queue full, rejecting job {}", job.id());
      tracker.fail(
          job.id(), ErrorDetail.of(FailureStage.INTERNAL, "Conversion queue is full, try later"));
      deleteQuietly(request.sourceFile());
      throw e;
    }

    LOGGER.info("Queued conversion job {} for {}", job.id(), request.originalFilename());
    return job.id();
  }

  /**
   * Current snapshot of a job.
   *
   * @throws com.scholary.narrator.job.JobNotFoundException if the id is unknown
   */
  public ConversionJob getStatus(String jobId) {
    return tracker.getStatus(jobId);
  }

  /**
   * Path of a completed job's MP3.
   *
   * @throws com.scholary.narrator.job.JobNotFoundException if the id is unknown
   * @throws JobNotCompleteException if the job has not completed
   */
  public Path getResult(String jobId) {
    ConversionJob job = tracker.getStatus(jobId);
    if (job.state() != JobState.COMPLETE) {
      throw new JobNotCompleteException(jobId, job.state());
    }
    return job.resultPath();
  }

  /**
   * Cancel a queued or running conversion.
   *
   * <p>The job is marked failed first, so pollers see the cancellation immediately; the task is
   * then interrupted and stops at its next checkpoint.
   *
   * @throws com.scholary.narrator.job.IllegalJobTransitionException if the job already finished
   */
  public ConversionJob cancel(String jobId) {
    ConversionJob cancelled =
        tracker.fail(jobId, ErrorDetail.of(FailureStage.CANCELLED, CANCELLED_MESSAGE));

    RunningConversion conversion = running.remove(jobId);
    if (conversion != null) {
      conversion.future().cancel(true);
      // A task cancelled before it started never cleans up its upload
      deleteQuietly(conversion.sourceFile());
    }

    LOGGER.info("Cancelled conversion job {}", jobId);
    return cancelled;
  }

  private ConversionJob createJob(ConversionRequest request) {
    if (!extractor.isSupported(request.originalFilename())) {
      deleteQuietly(request.sourceFile());
      throw new UnsupportedDocumentException(
          "Unsupported file type: "
              + request.originalFilename()
              + ". Only .pdf and .epub are supported");
    }

    String voice = voiceCatalog.resolve(request.voice());
    return tracker.create(
        voice,
        request.chunkingEnabled(),
        request.originalFilename(),
        outputFilename(request.originalFilename()));
  }

  /** {@code <basename>_<8 hex chars>.mp3}, so repeated conversions never overwrite each other. */
  static String outputFilename(String originalFilename) {
    String name = UploadStorage.sanitize(originalFilename);
    int dot = name.lastIndexOf('.');
    String base = dot > 0 ? name.substring(0, dot) : name;
    return base + "_" + UUID.randomUUID().toString().substring(0, 8) + ".mp3";
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

  private record RunningConversion(Future<?> future, Path sourceFile) {}
}
