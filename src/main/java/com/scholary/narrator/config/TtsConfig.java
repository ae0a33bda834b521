package com.scholary.narrator.config;

import com.scholary.narrator.tts.TtsProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the TTS client.
 *
 * <p>Enables the TtsProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(TtsProperties.class)
public class TtsConfig {}
