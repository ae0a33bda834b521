package com.scholary.narrator.cli;

import com.scholary.narrator.config.NarratorProperties.Voice;
import com.scholary.narrator.extraction.UnsupportedDocumentException;
import com.scholary.narrator.job.ConversionJob;
import com.scholary.narrator.job.JobState;
import com.scholary.narrator.service.ConversionRequest;
import com.scholary.narrator.service.ConversionService;
import com.scholary.narrator.service.UploadStorage;
import com.scholary.narrator.tts.VoiceCatalog;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Converts a single document from the command line.
 *
 * <p>Active with the {@code cli} profile:
 *
 * <pre>
 * --input=book.epub [--output=book.mp3] [--voice=en-US-AriaNeural] [--no-chunking]
 * --list-voices
 * </pre>
 *
 * <p>The input may also be given as the first non-option argument. An output path without an
 * {@code .mp3} extension has its extension replaced. Progress is printed as {@code STATUS:} lines;
 * the process exits with 2 for unusable arguments and with 1 when the conversion fails.
 */
@Component
@Profile("cli")
public class ConvertCommandRunner implements ApplicationRunner, ExitCodeGenerator {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConvertCommandRunner.class);

  private final ConversionService conversionService;
  private final UploadStorage uploadStorage;
  private final VoiceCatalog voiceCatalog;
  private final boolean chunkingByDefault;
  private final long pollIntervalMillis;
  private final PrintStream out;

  private int exitCode = 0;

  @Autowired
  public ConvertCommandRunner(
      ConversionService conversionService,
      UploadStorage uploadStorage,
      VoiceCatalog voiceCatalog,
      @Value("${narrator.chunking.enabled:true}") boolean chunkingByDefault,
      @Value("${narrator.cli.pollIntervalMillis:500}") long pollIntervalMillis) {
    this(
        conversionService,
        uploadStorage,
        voiceCatalog,
        chunkingByDefault,
        pollIntervalMillis,
        System.out);
  }

  ConvertCommandRunner(
      ConversionService conversionService,
      UploadStorage uploadStorage,
      VoiceCatalog voiceCatalog,
      boolean chunkingByDefault,
      long pollIntervalMillis,
      PrintStream out) {
    this.conversionService = conversionService;
    this.uploadStorage = uploadStorage;
    this.voiceCatalog = voiceCatalog;
    this.chunkingByDefault = chunkingByDefault;
    this.pollIntervalMillis = pollIntervalMillis;
    this.out = out;
  }

  @Override
  public void run(ApplicationArguments args) throws Exception {
    if (args.containsOption("list-voices")) {
      listVoices();
      return;
    }

    String input = optionValue(args, "input");
    if (input == null && !args.getNonOptionArgs().isEmpty()) {
      input = args.getNonOptionArgs().get(0);
    }
    if (input == null) {
      out.println("ERROR: --input=<file.epub|file.pdf> is required (or use --list-voices)");
      exitCode = 2;
      return;
    }

    Path inputFile = Paths.get(input);
    if (!Files.isRegularFile(inputFile)) {
      out.println("ERROR: Input file not found: " + inputFile);
      exitCode = 2;
      return;
    }

    boolean chunking = chunkingByDefault && !args.containsOption("no-chunking");
    String voice = optionValue(args, "voice");

    Path staged;
    try {
      staged = uploadStorage.store(inputFile);
    } catch (UnsupportedDocumentException e) {
      out.println("ERROR: " + e.getMessage());
      exitCode = 2;
      return;
    }
    String jobId =
        conversionService.submit(
            new ConversionRequest(staged, inputFile.getFileName().toString(), voice, chunking));
    out.println("STATUS: Queued job " + jobId);

    ConversionJob job = awaitCompletion(jobId);
    if (job.state() == JobState.COMPLETE) {
      Path result = job.resultPath();
      String output = optionValue(args, "output");
      if (output != null) {
        Path target = Paths.get(withMp3Extension(output));
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
          Files.createDirectories(parent);
        }
        Files.move(result, target, StandardCopyOption.REPLACE_EXISTING);
        result = target;
      }
      out.println("STATUS: Conversion complete: " + result.toAbsolutePath());
    } else {
      out.println("ERROR: " + job.errorDetail().message());
      if (job.errorDetail().retainedPath() != null) {
        out.println("Temporary chunk files kept in: " + job.errorDetail().retainedPath());
      }
      exitCode = 1;
    }
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }

  private ConversionJob awaitCompletion(String jobId) throws InterruptedException {
    String lastMessage = null;
    while (true) {
      ConversionJob job = conversionService.getStatus(jobId);
      String message = job.progress() == null ? null : job.progress().message();
      if (message != null && !Objects.equals(message, lastMessage)) {
        out.println("STATUS: " + message);
        lastMessage = message;
      }
      if (job.isTerminal()) {
        LOGGER.debug("Job {} finished in state {}", jobId, job.state());
        return job;
      }
      Thread.sleep(pollIntervalMillis);
    }
  }

  private void listVoices() {
    out.println("Available voices (use the short name with --voice):");
    for (Voice voice : voiceCatalog.voices()) {
      String marker = voice.shortName().equals(voiceCatalog.defaultVoice()) ? " (default)" : "";
      out.printf("  %-32s %s%s%n", voice.shortName(), voice.displayName(), marker);
    }
  }

  private String withMp3Extension(String output) {
    if (output.toLowerCase(Locale.ROOT).endsWith(".mp3")) {
      return output;
    }
    String name = Paths.get(output).getFileName().toString();
    int dot = name.lastIndexOf('.');
    String base = dot > 0 ? output.substring(0, output.length() - (name.length() - dot)) : output;
    String corrected = base + ".mp3";
    out.println("WARNING: Output extension was not .mp3, writing to " + corrected);
    return corrected;
  }

  private static String optionValue(ApplicationArguments args, String name) {
    List<String> values = args.getOptionValues(name);
    return values == null || values.isEmpty() ? null : values.get(0);
  }
}
