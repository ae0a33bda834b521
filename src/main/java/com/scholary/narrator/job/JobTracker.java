package com.scholary.narrator.job;

import com.scholary.narrator.logging.StructuredLogger;
import java.nio.file.Path;
import java.time.Instant;
import java.util.UUID;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Owns the state machine of every conversion job.
 *
 * <p>This is the only writer of job records. Each operation replaces the whole record atomically,
 * so pollers always see a consistent snapshot, and a job that reached {@code COMPLETE} or {@code
 * ERROR} never changes again.
 */
@Component
public class JobTracker {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobTracker.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final JobRepository repository;

  public JobTracker(JobRepository repository) {
    this.repository = repository;
  }

  /** Create a job in {@code QUEUED} with a fresh id. */
  public ConversionJob create(
      String voice, boolean chunkingEnabled, String sourceFilename, String outputFilename) {
    ConversionJob job =
        ConversionJob.queued(
            UUID.randomUUID().toString(),
            voice,
            chunkingEnabled,
            sourceFilename,
            outputFilename,
            Instant.now());
    repository.save(job);
    structuredLogger.logJobState(job.id(), "NEW", job.state().name(), job.version());
    return job;
  }

  public ConversionJob markProcessing(String jobId, JobProgress progress) {
    return transition(jobId, JobState.PROCESSING, job -> job.processing(progress, Instant.now()));
  }

  /**
   * Publish progress for a running job.
   *
   * <p>Ignored for jobs that are not processing, so a late update from a cancelled task cannot
   * touch a terminal record.
   */
  public ConversionJob updateProgress(String jobId, JobProgress progress) {
    return repository.compute(
        jobId,
        (id, current) -> {
          if (current == null) {
            throw new JobNotFoundException(id);
          }
          if (current.state() != JobState.PROCESSING) {
            LOGGER.debug("Ignoring progress for job {} in state {}", id, current.state());
            return current;
          }
          return current.withProgress(progress, Instant.now());
        });
  }

  public ConversionJob complete(String jobId, Path resultPath) {
    return transition(jobId, JobState.COMPLETE, job -> job.completed(resultPath, Instant.now()));
  }

  public ConversionJob fail(String jobId, ErrorDetail errorDetail) {
    return transition(jobId, JobState.ERROR, job -> job.failed(errorDetail, Instant.now()));
  }

  /**
   * Current snapshot of a job.
   *
   * @throws JobNotFoundException if the id is unknown or evicted
   */
  public ConversionJob getStatus(String jobId) {
    return repository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
  }

  private ConversionJob transition(
      String jobId, JobState target, UnaryOperator<ConversionJob> change) {
    JobState[] from = new JobState[1];
    ConversionJob updated;
    try {
      updated =
          repository.compute(
              jobId,
              (id, current) -> {
                if (current == null) {
                  throw new JobNotFoundException(id);
                }
                if (!current.state().canMoveTo(target)) {
                  throw new IllegalJobTransitionException(id, current.state(), target);
                }
                from[0] = current.state();
                return change.apply(current);
              });
    } catch (IllegalJobTransitionException e) {
      LOGGER.warn("Rejected transition: {}", e.getMessage());
      throw e;
    }

    structuredLogger.logJobState(jobId, from[0].name(), target.name(), updated.version());
    return updated;
  }
}
