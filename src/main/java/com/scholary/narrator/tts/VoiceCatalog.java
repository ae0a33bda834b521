package com.scholary.narrator.tts;

import com.scholary.narrator.config.NarratorProperties;
import com.scholary.narrator.config.NarratorProperties.Voice;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** The voices offered to clients, with fallback to the configured default. */
@Component
public class VoiceCatalog {

  private static final Logger LOGGER = LoggerFactory.getLogger(VoiceCatalog.class);

  private final String defaultVoice;
  private final List<Voice> voices;

  public VoiceCatalog(NarratorProperties properties) {
    this.defaultVoice = properties.voices().defaultVoice();
    this.voices = List.copyOf(properties.voices().available());
  }

  public String defaultVoice() {
    return defaultVoice;
  }

  public List<Voice> voices() {
    return voices;
  }

  public boolean isKnown(String shortName) {
    return voices.stream().anyMatch(voice -> voice.shortName().equals(shortName));
  }

  /**
   * Resolve a requested voice to one we offer.
   *
   * <p>Blank or unknown voices fall back to the default.
   */
  public String resolve(String requested) {
    if (requested == null || requested.isBlank()) {
      return defaultVoice;
    }
    String trimmed = requested.strip();
    if (isKnown(trimmed)) {
      return trimmed;
    }
    LOGGER.warn("Invalid voice '{}' requested, falling back to default {}", trimmed, defaultVoice);
    return defaultVoice;
  }
}
