package com.scholary.narrator.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for conversion-related beans.
 *
 * <p>Enables the NarratorProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(NarratorProperties.class)
public class NarratorConfig {}
