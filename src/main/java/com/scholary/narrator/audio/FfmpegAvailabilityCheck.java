package com.scholary.narrator.audio;

import java.io.IOException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Runs {@code ffmpeg -version} once the application is up.
 *
 * <p>A missing binary is logged but does not stop startup; merges will fail with a clear error.
 */
@Component
public class FfmpegAvailabilityCheck {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegAvailabilityCheck.class);

  private final FfmpegProperties properties;

  public FfmpegAvailabilityCheck(FfmpegProperties properties) {
    this.properties = properties;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void onApplicationReady() {
    if (isAvailable()) {
      LOGGER.info("ffmpeg found: {}", properties.binary());
    } else {
      LOGGER.error(
          "ffmpeg not available ({}). Install ffmpeg and add it to the PATH, "
              + "otherwise multi-chunk conversions will fail at the merge step",
          properties.binary());
    }
  }

  /** Whether the configured binary runs and exits cleanly. */
  public boolean isAvailable() {
    ProcessBuilder pb = new ProcessBuilder(properties.binary(), "-version");
    pb.redirectErrorStream(true);
    pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);

    try {
      Process process = pb.start();
      if (!process.waitFor(10, TimeUnit.SECONDS)) {
        process.destroyForcibly();
        return false;
      }
      return process.exitValue() == 0;
    } catch (IOException e) {
      LOGGER.debug("ffmpeg version check failed: {}", e.getMessage());
      return false;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }
}
