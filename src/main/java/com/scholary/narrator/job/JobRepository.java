package com.scholary.narrator.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import java.io.IOException;
import java.nio.file.Files;
import java.time.Duration;
import java.util.Optional;
import java.util.function.BiFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory repository for conversion jobs.
 *
 * <p>Uses Caffeine cache for automatic eviction of old jobs. This keeps memory usage bounded and
 * ensures we don't accumulate finished jobs forever. When a completed job is evicted its MP3 is
 * deleted with it, since nobody can download it any more.
 */
@Repository
public class JobRepository {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobRepository.class);

  private final Cache<String, ConversionJob> cache;

  public JobRepository(
      @Value("${jobstore.maxSize}") int maxSize,
      @Value("${jobstore.expireAfterMinutes}") int expireAfterMinutes) {

    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofMinutes(expireAfterMinutes))
            .removalListener(
                (String jobId, ConversionJob job, RemovalCause cause) -> {
                  if (cause.wasEvicted()) {
                    onEvicted(job);
                  }
                })
            .build();
  }

  public void save(ConversionJob job) {
    cache.put(job.id(), job);
  }

  public Optional<ConversionJob> findById(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }

  /**
   * Atomically replace the record for a job.
   *
   * <p>The remapping function sees the current record (null if absent) and runs under the entry's
   * lock, so concurrent transitions on the same job are serialized. Exceptions it throws leave the
   * stored record unchanged.
   */
  public ConversionJob compute(
      String jobId, BiFunction<String, ConversionJob, ConversionJob> remapping) {
    return cache.asMap().compute(jobId, remapping);
  }

  public void delete(String jobId) {
    cache.invalidate(jobId);
  }

  private void onEvicted(ConversionJob job) {
    if (job == null || job.state() != JobState.COMPLETE || job.resultPath() == null) {
      return;
    }
    try {
      if (Files.deleteIfExists(job.resultPath())) {
        LOGGER.info("Deleted output of evicted job {}: {}", job.id(), job.resultPath());
      }
    } catch (IOException e) {
      LOGGER.warn("Failed to delete output of evicted job {}: {}", job.id(), e.getMessage());
    }
  }
}
