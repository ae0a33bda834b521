package com.scholary.narrator.config;

import com.scholary.narrator.synthesis.FailurePolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for document conversion.
 *
 * <p>Controls working directories, the conversion thread pool, chunking limits, synthesis retry
 * behaviour and the voices offered to clients.
 */
@ConfigurationProperties(prefix = "narrator")
@Validated
public record NarratorProperties(
    @NotBlank String tempDir,
    @NotBlank String outputDir,
    @NotBlank String uploadDir,
    @Positive int conversionThreads,
    @Positive int conversionQueueSize,
    @Valid @NotNull ChunkingProperties chunking,
    @Valid @NotNull SynthesisProperties synthesis,
    @Valid @NotNull VoiceProperties voices) {

  public record ChunkingProperties(
      boolean enabled,
      @Positive int maxChunkChars,
      @Positive int maxChunks) {}

  /**
   * Synthesis behaviour per chunk.
   *
   * <p>{@code maxAttempts} of 1 disables retry.
   */
  public record SynthesisProperties(
      @Positive int maxAttempts,
      @PositiveOrZero long backoffMillis,
      @Positive int chunkTimeoutSeconds,
      @Positive int parallelism,
      @NotNull FailurePolicy failurePolicy) {}

  public record VoiceProperties(
      @NotBlank String defaultVoice,
      @NotEmpty List<@Valid Voice> available) {}

  public record Voice(@NotBlank String displayName, @NotBlank String shortName) {}
}
