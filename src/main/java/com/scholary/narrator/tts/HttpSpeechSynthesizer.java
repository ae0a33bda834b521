package com.scholary.narrator.tts;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for an OpenAI-compatible speech endpoint.
 *
 * <p>Posts {@code {"model", "input", "voice", "response_format"}} as JSON and returns the raw audio
 * bytes of the response body. One request per call: the synthesis invoker owns timeouts and
 * retries.
 */
@Component
public class HttpSpeechSynthesizer implements SpeechSynthesizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpSpeechSynthesizer.class);

  private static final int MAX_ERROR_BODY_CHARS = 500;

  private final HttpClient httpClient;
  private final TtsProperties properties;
  private final ObjectMapper objectMapper;
  private final URI endpoint;

  public HttpSpeechSynthesizer(TtsProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.endpoint = URI.create(stripTrailingSlash(properties.baseUrl()) + properties.endpoint());

    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info("Initialized TTS client: endpoint={}", endpoint);
  }

  @Override
  public byte[] synthesize(String text, String voice) {
    LOGGER.debug("Synthesizing {} characters with voice {}", text.length(), voice);

    HttpRequest.Builder builder =
        HttpRequest.newBuilder()
            .uri(endpoint)
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Content-Type", "application/json")
            .header("Accept", "audio/mpeg")
            .POST(BodyPublishers.ofByteArray(buildBody(text, voice)));
    if (properties.apiKey() != null && !properties.apiKey().isBlank()) {
      builder.header("Authorization", "Bearer " + properties.apiKey());
    }
    HttpRequest request = builder.build();

    HttpResponse<byte[]> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
    } catch (IOException e) {
      throw new TtsServiceException("TTS request failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TtsServiceException("TTS request interrupted", e);
    }

    if (response.statusCode() != 200) {
      throw new TtsServiceException(
          String.format(
              "TTS service returned status %d: %s",
              response.statusCode(), errorBody(response.body())),
          response.statusCode());
    }

    byte[] audio = response.body() == null ? new byte[0] : response.body();
    LOGGER.debug("Received {} bytes of audio", audio.length);
    return audio;
  }

  private byte[] buildBody(String text, String voice) {
    Map<String, Object> body = new LinkedHashMap<>();
    if (properties.model() != null && !properties.model().isBlank()) {
      body.put("model", properties.model());
    }
    body.put("input", text);
    body.put("voice", voice);
    body.put("response_format", properties.responseFormat());

    try {
      return objectMapper.writeValueAsBytes(body);
    } catch (JsonProcessingException e) {
      throw new TtsServiceException("Failed to serialize TTS request", e);
    }
  }

  private static String errorBody(byte[] body) {
    if (body == null || body.length == 0) {
      return "<empty>";
    }
    String text = new String(body, StandardCharsets.UTF_8);
    return text.length() > MAX_ERROR_BODY_CHARS ? text.substring(0, MAX_ERROR_BODY_CHARS) : text;
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
