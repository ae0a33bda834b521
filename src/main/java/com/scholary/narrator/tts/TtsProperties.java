package com.scholary.narrator.tts;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the TTS client.
 *
 * <p>These control how we connect to the speech service (or mock). {@code apiKey} and {@code
 * model} are optional; they are only sent when set.
 */
@ConfigurationProperties(prefix = "tts")
@Validated
public record TtsProperties(
    @NotBlank String baseUrl,
    @NotBlank String endpoint,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @NotBlank String responseFormat,
    String apiKey,
    String model) {}
