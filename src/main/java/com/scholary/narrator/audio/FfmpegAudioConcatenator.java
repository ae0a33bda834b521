package com.scholary.narrator.audio;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Joins MP3 segments with the ffmpeg concat demuxer.
 *
 * <p>A {@code concat_list.txt} is written next to the segments, one {@code file '<path>'} line per
 * segment, and ffmpeg copies the streams into the output without re-encoding. A single segment is
 * moved into place without running ffmpeg at all.
 */
@Component
public class FfmpegAudioConcatenator implements AudioConcatenator {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegAudioConcatenator.class);

  static final String CONCAT_LIST_NAME = "concat_list.txt";
  private static final String FFMPEG_LOG_NAME = "ffmpeg.log";
  private static final int MAX_ERROR_OUTPUT_CHARS = 2000;

  private final FfmpegProperties properties;

  public FfmpegAudioConcatenator(FfmpegProperties properties) {
    this.properties = properties;
  }

  @Override
  public void concat(List<Path> orderedSegments, Path output) {
    if (orderedSegments.isEmpty()) {
      throw new MergeException("No audio segments to merge");
    }
    for (Path segment : orderedSegments) {
      if (!Files.isRegularFile(segment)) {
        throw new MergeException("Audio segment missing: " + segment);
      }
    }

    try {
      Path outputDir = output.toAbsolutePath().getParent();
      if (outputDir != null) {
        Files.createDirectories(outputDir);
      }

      if (orderedSegments.size() == 1) {
        LOGGER.info(
            "Single segment, moving {} to {}", orderedSegments.get(0).getFileName(), output);
        Files.move(orderedSegments.get(0), output, StandardCopyOption.REPLACE_EXISTING);
        return;
      }

      Path workDir = orderedSegments.get(0).toAbsolutePath().getParent();
      Path concatList = writeConcatList(orderedSegments, workDir);
      runFfmpeg(concatList, output, workDir.resolve(FFMPEG_LOG_NAME));

    } catch (IOException e) {
      throw new MergeException("Failed to merge audio segments: " + e.getMessage(), e);
    }

    LOGGER.info("Merged {} segments into {}", orderedSegments.size(), output);
  }

  private Path writeConcatList(List<Path> segments, Path workDir) throws IOException {
    List<String> lines = new ArrayList<>(segments.size());
    for (Path segment : segments) {
      lines.add("file '" + escape(segment.toAbsolutePath().toString()) + "'");
    }
    Path concatList = workDir.resolve(CONCAT_LIST_NAME);
    Files.write(concatList, lines, StandardCharsets.UTF_8);
    LOGGER.debug("Wrote concat list with {} entries: {}", lines.size(), concatList);
    return concatList;
  }

  private void runFfmpeg(Path concatList, Path output, Path logFile) throws IOException {
    ProcessBuilder pb =
        new ProcessBuilder(
            properties.binary(),
            "-y",
            "-f", "concat",
            "-safe", "0",
            "-i", concatList.toAbsolutePath().toString(),
            "-c", "copy",
            output.toAbsolutePath().toString());
    pb.redirectErrorStream(true);
    pb.redirectOutput(logFile.toFile());

    LOGGER.debug("Running: {}", String.join(" ", pb.command()));

    Process process;
    try {
      process = pb.start();
    } catch (IOException e) {
      throw new MergeException(
          "ffmpeg not found or not executable: " + properties.binary(), e);
    }

    try {
      if (!process.waitFor(properties.mergeTimeoutSeconds(), TimeUnit.SECONDS)) {
        process.destroyForcibly();
        throw new MergeException(
            String.format(
                "ffmpeg merge timed out after %d seconds", properties.mergeTimeoutSeconds()));
      }
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new MergeException("ffmpeg merge interrupted", e);
    }

    int exitCode = process.exitValue();
    if (exitCode != 0) {
      throw new MergeException(
          String.format("ffmpeg exited with code %d: %s", exitCode, outputTail(logFile)));
    }
  }

  private static String outputTail(Path logFile) {
    try {
      String text = Files.readString(logFile, StandardCharsets.UTF_8).strip();
      return text.length() > MAX_ERROR_OUTPUT_CHARS
          ? text.substring(text.length() - MAX_ERROR_OUTPUT_CHARS)
          : text;
    } catch (IOException e) {
      return "<no output: " + e.getMessage() + ">";
    }
  }

  /** Escape a path for a single-quoted concat list entry. */
  static String escape(String path) {
    return path.replace("'", "'\\''");
  }
}
